package com.tickety.initiator.relay.dto;

/**
 * {@code operation} is the cancelled operation for {@link Status#CANCELLED}, and the terminal state
 * that came first for {@link Status#ALREADY_TERMINAL} when it could be read. It is null otherwise.
 */
public record CancelResult(Status status, OperationSnapshot operation) {

  public enum Status {
    CANCELLED,
    NOT_AUTHORIZED,
    ALREADY_TERMINAL,
    NOT_FOUND
  }

  public boolean isCancelled() {
    return status == Status.CANCELLED;
  }
}
