/*
 * Where: handoff domain model
 * What: the ledger fields of a ticket the handshake needs
 * Why: ownership checks and transfers read and write only these columns
 */
package com.tickety.handoff.model;

import java.time.Instant;

public record TicketRecord(
    String ticketId,
    String eventId,
    String ticketNumber,
    String ownerActorId,
    String ownerEmail,
    long version,
    Instant updatedAt) {

  public boolean isOwnedBy(String actorId) {
    return ownerActorId != null && ownerActorId.equals(actorId);
  }
}
