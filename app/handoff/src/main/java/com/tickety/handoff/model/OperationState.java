/*
 * Where: handoff domain model
 * What: persisted lifecycle states of a pending operation and the legal moves between them
 * Why: no transition may leave a terminal state, and every caller checks the same table
 */
package com.tickety.handoff.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Persisted operation states. The initiator-side {@code WAITING} phase precedes row creation and
 * therefore never appears here.
 */
public enum OperationState {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED,
  CANCELLED,
  EXPIRED;

  public boolean isTerminal() {
    return switch (this) {
      case PENDING, PROCESSING -> false;
      case COMPLETED, FAILED, CANCELLED, EXPIRED -> true;
    };
  }

  public boolean canTransitionTo(OperationState target) {
    return sourcesOf(target).contains(this);
  }

  /** States from which {@code target} may be entered. */
  public static Set<OperationState> sourcesOf(OperationState target) {
    return switch (target) {
      case PENDING -> EnumSet.noneOf(OperationState.class);
      case PROCESSING -> EnumSet.of(PENDING);
      case COMPLETED -> EnumSet.of(PROCESSING);
      case FAILED, CANCELLED, EXPIRED -> EnumSet.of(PENDING, PROCESSING);
    };
  }

  public static Set<OperationState> open() {
    return EnumSet.of(PENDING, PROCESSING);
  }
}
