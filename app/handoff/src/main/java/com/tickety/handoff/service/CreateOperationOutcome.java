package com.tickety.handoff.service;

import com.tickety.handoff.model.PendingOperationRecord;
import com.tickety.handoff.model.TransferTokenRecord;

/** {@code token} is present only for created transfers. */
public record CreateOperationOutcome(
    Status status, PendingOperationRecord operation, TransferTokenRecord token) {

  public enum Status {
    CREATED,
    TICKET_NOT_FOUND,
    NOT_OWNER,
    ALREADY_LISTED_OR_PENDING
  }

  static CreateOperationOutcome rejected(IssueOutcome.Status issueStatus) {
    final Status status =
        switch (issueStatus) {
          case NOT_FOUND -> Status.TICKET_NOT_FOUND;
          case NOT_OWNER -> Status.NOT_OWNER;
          case ALREADY_LISTED_OR_PENDING -> Status.ALREADY_LISTED_OR_PENDING;
          case ISSUED -> throw new IllegalArgumentException("issued token is not a rejection");
        };
    return new CreateOperationOutcome(status, null, null);
  }

  public boolean isCreated() {
    return status == Status.CREATED;
  }
}
