package com.tickety.handoff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.service.CounterpartyResolution;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmailLookupResponse(String status, String actorId, String email) {

  static EmailLookupResponse from(CounterpartyResolution resolution) {
    return new EmailLookupResponse(
        resolution.kind().name(), resolution.actorId(), resolution.email());
  }
}
