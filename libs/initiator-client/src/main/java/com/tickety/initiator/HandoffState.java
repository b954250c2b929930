/*
 * Where: initiator client state machine
 * What: the handshake states as the initiator device sees them
 * Why: WAITING exists only on the device, before any relay row is created
 */
package com.tickety.initiator;

import com.tickety.common.event.OperationStates;

public enum HandoffState {
  WAITING,
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED,
  CANCELLED,
  EXPIRED;

  public boolean isTerminal() {
    return OperationStates.isTerminal(name());
  }

  /** Maps a relay state string; the relay never reports {@link #WAITING}. */
  public static HandoffState fromWire(String state) {
    if (state == null || WAITING.name().equals(state)) {
      throw new IllegalArgumentException("unknown relay state: " + state);
    }
    return HandoffState.valueOf(state);
  }
}
