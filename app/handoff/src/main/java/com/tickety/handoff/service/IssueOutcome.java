package com.tickety.handoff.service;

import com.tickety.handoff.model.TransferTokenRecord;

public record IssueOutcome(Status status, TransferTokenRecord token) {

  public enum Status {
    ISSUED,
    NOT_FOUND,
    NOT_OWNER,
    ALREADY_LISTED_OR_PENDING
  }

  static IssueOutcome issued(TransferTokenRecord token) {
    return new IssueOutcome(Status.ISSUED, token);
  }

  static IssueOutcome rejected(Status status) {
    return new IssueOutcome(status, null);
  }

  public boolean isIssued() {
    return status == Status.ISSUED;
  }
}
