/*
 * Where: initiator client realtime
 * What: one state of an operation delivered to the device, from the snapshot or a live event
 * Why: the device applies snapshot and live states through one path
 */
package com.tickety.initiator.realtime;

import com.tickety.common.event.OperationStateChangedPayload;
import com.tickety.initiator.HandoffState;
import com.tickety.initiator.relay.dto.OperationSnapshot;

public record OperationUpdate(
    String operationId,
    HandoffState state,
    String terminalReason,
    long sequence,
    String updatedAt,
    boolean snapshot) {

  public static OperationUpdate fromSnapshot(OperationSnapshot snapshot) {
    return new OperationUpdate(
        snapshot.operationId(),
        HandoffState.fromWire(snapshot.state()),
        snapshot.terminalReason(),
        snapshot.sequence(),
        snapshot.updatedAt() == null ? null : snapshot.updatedAt().toString(),
        true);
  }

  static OperationUpdate fromEvent(OperationStateChangedPayload payload) {
    return new OperationUpdate(
        payload.operationId(),
        HandoffState.fromWire(payload.state()),
        payload.terminalReason(),
        payload.sequence(),
        payload.updatedAt(),
        false);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }
}
