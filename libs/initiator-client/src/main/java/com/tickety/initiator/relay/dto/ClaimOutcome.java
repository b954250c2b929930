package com.tickety.initiator.relay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code error} is one of the relay's claim error strings, absent on success. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClaimOutcome(
    TicketSummary ticket, String error, String operationId, boolean replayed) {

  public boolean isClaimed() {
    return error == null && ticket != null;
  }
}
