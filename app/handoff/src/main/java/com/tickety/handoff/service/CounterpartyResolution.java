package com.tickety.handoff.service;

/** {@code actorId} is set only for {@link Kind#REGISTERED}; {@code email} is always normalised. */
public record CounterpartyResolution(Kind kind, String actorId, String email) {

  public enum Kind {
    REGISTERED,
    UNREGISTERED
  }

  public boolean isRegistered() {
    return kind == Kind.REGISTERED;
  }
}
