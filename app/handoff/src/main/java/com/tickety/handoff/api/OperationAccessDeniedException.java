package com.tickety.handoff.api;

import java.util.UUID;

public class OperationAccessDeniedException extends RuntimeException {

  public OperationAccessDeniedException(UUID operationId) {
    super("not a party of operation " + operationId);
  }
}
