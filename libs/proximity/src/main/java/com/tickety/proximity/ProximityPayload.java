/*
 * Where: proximity codec model
 * What: the small identity or claim payload exchanged between co-located devices
 * Why: both devices need one validated shape before anything reaches the relay
 */
package com.tickety.proximity;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ephemeral payload carried over the proximity channel. Never persisted.
 *
 * <p>Identifiers are restricted to URL-safe characters so that every sub-format can carry them
 * without escaping, which keeps encoding deterministic.
 */
public record ProximityPayload(PayloadKind kind, String subjectId, String correlationHint) {

  static final int MAX_SUBJECT_LENGTH = 128;
  static final int MAX_HINT_LENGTH = 64;
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9._-]+");

  public ProximityPayload {
    Objects.requireNonNull(kind, "kind is required");
    if (!isIdentifier(subjectId, MAX_SUBJECT_LENGTH)) {
      throw new IllegalArgumentException("subjectId is invalid");
    }
    if (correlationHint != null && !isIdentifier(correlationHint, MAX_HINT_LENGTH)) {
      throw new IllegalArgumentException("correlationHint is invalid");
    }
  }

  public static ProximityPayload customerIdentity(String actorId) {
    return new ProximityPayload(PayloadKind.CUSTOMER_IDENTITY, actorId, null);
  }

  public static ProximityPayload ticketClaim(String transferToken, String correlationHint) {
    return new ProximityPayload(PayloadKind.TICKET_CLAIM, transferToken, correlationHint);
  }

  public Optional<String> hint() {
    return Optional.ofNullable(correlationHint);
  }

  static boolean isIdentifier(String value, int maxLength) {
    return value != null
        && !value.isEmpty()
        && value.length() <= maxLength
        && IDENTIFIER.matcher(value).matches();
  }
}
