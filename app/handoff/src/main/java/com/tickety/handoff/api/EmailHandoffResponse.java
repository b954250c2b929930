package com.tickety.handoff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.service.EmailHandoffOutcome;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmailHandoffResponse(
    String status, TicketView ticket, String recipientActorId, String deliveryId) {

  static EmailHandoffResponse from(EmailHandoffOutcome outcome) {
    return new EmailHandoffResponse(
        outcome.status().name(),
        TicketView.from(outcome.ticket()),
        outcome.recipientActorId(),
        outcome.deliveryId() == null ? null : outcome.deliveryId().toString());
  }
}
