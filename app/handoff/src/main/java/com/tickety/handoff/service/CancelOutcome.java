package com.tickety.handoff.service;

import com.tickety.handoff.model.PendingOperationRecord;

public record CancelOutcome(Status status, PendingOperationRecord operation) {

  public enum Status {
    CANCELLED,
    NOT_AUTHORIZED,
    ALREADY_TERMINAL,
    NOT_FOUND
  }
}
