/*
 * Where: handoff domain model
 * What: snapshot of one transfer_tokens row
 * Why: redemption outcomes are decided from this record under the ticket lock
 */
package com.tickety.handoff.model;

import java.time.Instant;

public record TransferTokenRecord(
    String tokenId,
    String ticketId,
    String holderActorId,
    TokenStatus status,
    Instant issuedAt,
    Instant expiresAt,
    String redeemedBy,
    Instant redeemedAt) {

  public boolean redeemed() {
    return status == TokenStatus.REDEEMED;
  }

  public boolean isPastWindow(Instant now) {
    return !now.isBefore(expiresAt);
  }

  /** Log-safe form; the full id is a bearer credential. */
  public String shortId() {
    return shorten(tokenId);
  }

  public static String shorten(String tokenId) {
    if (tokenId == null) {
      return "null";
    }
    return tokenId.length() <= 8 ? tokenId : tokenId.substring(0, 8);
  }
}
