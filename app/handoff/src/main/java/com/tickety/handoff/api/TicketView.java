package com.tickety.handoff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.model.TicketRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TicketView(
    String ticketId, String eventId, String ticketNumber, String ownerActorId, String ownerEmail) {

  static TicketView from(TicketRecord ticket) {
    if (ticket == null) {
      return null;
    }
    return new TicketView(
        ticket.ticketId(),
        ticket.eventId(),
        ticket.ticketNumber(),
        ticket.ownerActorId(),
        ticket.ownerEmail());
  }
}
