/*
 * Where: handoff domain model
 * What: the two kinds of handshake a pending operation can represent
 * Why: relay branches switch exhaustively on the kind instead of subclassing operations
 */
package com.tickety.handoff.model;

public enum OperationKind {
  /** Counterparty authorises a charge against subjectRef and amount; no token. */
  PAYMENT,
  /** Counterparty redeems the operation's transfer token to take ownership of a ticket. */
  TRANSFER
}
