package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IncomingOperationsResponse(String actorId, List<OperationResponse> items) {

  public IncomingOperationsResponse {
    items = List.copyOf(items);
  }
}
