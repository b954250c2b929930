/*
 * Where: shared realtime event schema
 * What: the state change message published for every pending-operation transition
 * Why: the relay and initiator devices must agree on one wire shape
 */
package com.tickety.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Realtime state change of one pending operation.
 *
 * <p>{@code sequence} equals the operation version after the transition, so a subscriber can
 * discard anything it has already seen. {@code terminalReason} is only present on terminal states.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationStateChangedPayload(
    String eventId,
    String operationId,
    String kind,
    String state,
    String terminalReason,
    String updatedAt,
    long sequence,
    String traceId) {

  public static final String EVENT_TYPE = "OperationStateChanged";

  @JsonIgnore
  public boolean isTerminal() {
    return OperationStates.isTerminal(state);
  }
}
