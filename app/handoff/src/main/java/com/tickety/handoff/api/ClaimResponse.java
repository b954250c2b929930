package com.tickety.handoff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.service.ClaimResult;

/**
 * Claim response: {@code ticket} on success, {@code error} otherwise. {@code replayed} marks a
 * repeated claim by the party that already won.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimResponse(
    TicketView ticket, String error, String operationId, boolean replayed) {

  static ClaimResponse from(ClaimResult result) {
    return new ClaimResponse(
        result.isClaimed() ? TicketView.from(result.ticket()) : null,
        result.status().wireError(),
        result.operationId() == null ? null : result.operationId().toString(),
        result.replayed());
  }
}
