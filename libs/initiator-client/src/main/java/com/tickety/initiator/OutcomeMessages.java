/*
 * Where: initiator client presentation helpers
 * What: user-visible text for every handshake state and claim error
 * Why: each terminal state must read differently, and a failure names its reason
 */
package com.tickety.initiator;

import com.tickety.common.event.OperationStates;

public final class OutcomeMessages {

  private OutcomeMessages() {}

  public static String forState(HandoffState state, String terminalReason) {
    return switch (state) {
      case WAITING -> "Waiting for a nearby device";
      case PENDING -> "Waiting for the other device to confirm";
      case PROCESSING -> "Processing";
      case COMPLETED -> "Completed";
      case FAILED -> forFailure(terminalReason);
      case CANCELLED -> "Cancelled";
      case EXPIRED -> "Timed out before it was confirmed";
    };
  }

  /** Message for the claimant; {@code wireError} is the error string of the claim response. */
  public static String forClaimError(String wireError) {
    if (wireError == null) {
      return "Ticket received";
    }
    return switch (wireError) {
      case "expired" -> "This transfer has expired";
      case "already_redeemed" -> "This ticket was already claimed";
      case "not_found" -> "This transfer is not valid";
      case "revoked" -> "The sender withdrew this transfer";
      case "operation_cancelled" -> "The sender cancelled this transfer";
      case "not_owner" -> "The sender no longer owns this ticket";
      case "self_transfer" -> "You already own this ticket";
      case "not_authorized" -> "This transfer is addressed to someone else";
      default -> "The ticket could not be claimed";
    };
  }

  private static String forFailure(String terminalReason) {
    if (terminalReason == null || terminalReason.isBlank()) {
      return "Failed";
    }
    return switch (terminalReason) {
      case OperationStates.REASON_ALREADY_REDEEMED -> "Failed: the ticket was already claimed";
      case OperationStates.REASON_NOT_OWNER -> "Failed: the ticket no longer belongs to the sender";
      default -> "Failed: " + terminalReason;
    };
  }
}
