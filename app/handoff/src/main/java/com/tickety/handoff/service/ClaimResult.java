/*
 * Where: handoff service layer
 * What: typed result of a claim, with the wire error string each rejection carries
 * Why: the receiving device shows the rejection string verbatim
 */
package com.tickety.handoff.service;

import com.tickety.handoff.model.TicketRecord;
import java.util.UUID;

public record ClaimResult(Status status, TicketRecord ticket, UUID operationId, boolean replayed) {

  public enum Status {
    CLAIMED(null),
    EXPIRED("expired"),
    ALREADY_REDEEMED("already_redeemed"),
    NOT_FOUND("not_found"),
    REVOKED("revoked"),
    OPERATION_CANCELLED("operation_cancelled"),
    NOT_OWNER("not_owner"),
    SELF_TRANSFER("self_transfer"),
    NOT_AUTHORIZED("not_authorized");

    private final String wireError;

    Status(String wireError) {
      this.wireError = wireError;
    }

    /** Error string of the claim response; null on success. */
    public String wireError() {
      return wireError;
    }
  }

  static ClaimResult rejected(Status status, TicketRecord ticket, UUID operationId) {
    return new ClaimResult(status, ticket, operationId, false);
  }

  public boolean isClaimed() {
    return status == Status.CLAIMED;
  }
}
