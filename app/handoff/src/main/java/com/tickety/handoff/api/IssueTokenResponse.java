package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.model.TransferTokenRecord;
import java.time.Instant;

/** Carries the full bearer token; it is returned to the holder exactly once. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueTokenResponse(
    String transferToken, String ticketId, Instant issuedAt, Instant expiresAt) {

  static IssueTokenResponse from(TransferTokenRecord token) {
    return new IssueTokenResponse(
        token.tokenId(), token.ticketId(), token.issuedAt(), token.expiresAt());
  }
}
