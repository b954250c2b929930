/*
 * Where: handoff domain model
 * What: snapshot of one pending_operations row
 * Why: the relay, the claim path and the API all read the same shape
 */
package com.tickety.handoff.model;

import java.time.Instant;
import java.util.UUID;

public record PendingOperationRecord(
    UUID operationId,
    OperationTerms terms,
    String initiatorActorId,
    String counterpartyActorId,
    String subjectRef,
    OperationState state,
    String terminalReason,
    String chargeRef,
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt,
    long version) {

  public OperationKind kind() {
    return terms.kind();
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  /** The relay clock decides: an operation is past its window from expiresAt onwards. */
  public boolean isPastWindow(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
