package com.tickety.handoff.service;

import com.tickety.handoff.model.TicketRecord;
import java.util.List;

/**
 * Tickets attached to an actor on its first login, and how many deferred deliveries closed.
 * {@link Status#EMAIL_MISMATCH} means the email is registered to a different actor, or the actor is
 * registered with a different email; nothing is bound then.
 */
public record DeferredBindResult(
    Status status, String actorId, List<TicketRecord> tickets, int deliveries) {

  public enum Status {
    BOUND,
    EMAIL_MISMATCH
  }

  public DeferredBindResult {
    tickets = List.copyOf(tickets);
  }

  public static DeferredBindResult bound(String actorId, List<TicketRecord> tickets, int deliveries) {
    return new DeferredBindResult(Status.BOUND, actorId, tickets, deliveries);
  }

  public static DeferredBindResult emailMismatch(String actorId) {
    return new DeferredBindResult(Status.EMAIL_MISMATCH, actorId, List.of(), 0);
  }
}
