package com.tickety.handoff.service;

import com.tickety.handoff.model.PendingOperationRecord;

/**
 * {@code NO_OP} means the operation already was in the requested state; {@code EXPIRED} means the
 * window had closed and the relay expired the operation instead. {@code operation} is the current
 * row, absent only for {@code NOT_FOUND}.
 */
public record TransitionOutcome(Status status, PendingOperationRecord operation) {

  public enum Status {
    APPLIED,
    NO_OP,
    NOT_FOUND,
    NOT_AUTHORIZED,
    ILLEGAL_TRANSITION,
    EXPIRED,
    INVALID_KIND
  }

  static TransitionOutcome of(Status status, PendingOperationRecord operation) {
    return new TransitionOutcome(status, operation);
  }
}
