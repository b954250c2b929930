/*
 * Where: proximity codec model
 * What: the two kinds of payload exchanged over the short-range channel
 * Why: a decoded frame must say whether it identifies a customer or a ticket claim
 */
package com.tickety.proximity;

public enum PayloadKind {
  /** Customer device broadcasts its actor id so a vendor can request a payment. */
  CUSTOMER_IDENTITY("TICKETY_PAY", "pay"),
  /** Holder device broadcasts a transfer token so a nearby reader can claim the ticket. */
  TICKET_CLAIM("TICKETY_CLAIM", "claim");

  private final String namespace;
  private final String uriSegment;

  PayloadKind(String namespace, String uriSegment) {
    this.namespace = namespace;
    this.uriSegment = uriSegment;
  }

  public String namespace() {
    return namespace;
  }

  public String uriSegment() {
    return uriSegment;
  }

  static PayloadKind fromNamespace(String namespace) {
    for (PayloadKind kind : values()) {
      if (kind.namespace.equals(namespace)) {
        return kind;
      }
    }
    return null;
  }

  static PayloadKind fromUriSegment(String segment) {
    for (PayloadKind kind : values()) {
      if (kind.uriSegment.equals(segment)) {
        return kind;
      }
    }
    return null;
  }
}
