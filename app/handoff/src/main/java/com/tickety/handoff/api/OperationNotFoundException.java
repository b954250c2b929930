package com.tickety.handoff.api;

import java.util.UUID;

public class OperationNotFoundException extends RuntimeException {

  public OperationNotFoundException(UUID operationId) {
    super("operation not found: " + operationId);
  }
}
