/*
 * Where: handoff service layer
 * What: typed result of a redemption attempt
 * Why: losing a redemption race is an expected outcome, not an error
 */
package com.tickety.handoff.service;

import com.tickety.handoff.model.TicketRecord;
import com.tickety.handoff.model.TransferTokenRecord;

/**
 * {@code token} is the token as observed under the ticket lock and is absent only for {@link
 * Status#NOT_FOUND}. {@code ticket} is the ticket after the ownership change on success, and the
 * current ticket otherwise.
 */
public record RedeemOutcome(Status status, TransferTokenRecord token, TicketRecord ticket) {

  public enum Status {
    REDEEMED,
    ALREADY_REDEEMED,
    EXPIRED,
    REVOKED,
    NOT_FOUND,
    NOT_OWNER,
    SELF_TRANSFER
  }

  static RedeemOutcome notFound() {
    return new RedeemOutcome(Status.NOT_FOUND, null, null);
  }

  public boolean isRedeemed() {
    return status == Status.REDEEMED;
  }
}
