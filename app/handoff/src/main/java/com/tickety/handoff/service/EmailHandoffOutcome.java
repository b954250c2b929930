package com.tickety.handoff.service;

import com.tickety.handoff.model.TicketRecord;
import java.util.UUID;

/**
 * {@code DELIVERED} moved ownership to a registered actor in band; {@code DEFERRED} parked the
 * ticket on the email until its first login, identified by {@code deliveryId}.
 */
public record EmailHandoffOutcome(
    Status status, TicketRecord ticket, String recipientActorId, UUID deliveryId) {

  public enum Status {
    DELIVERED,
    DEFERRED,
    TICKET_NOT_FOUND,
    NOT_OWNER,
    ALREADY_LISTED_OR_PENDING,
    SELF_TRANSFER
  }

  static EmailHandoffOutcome rejected(Status status) {
    return new EmailHandoffOutcome(status, null, null, null);
  }
}
