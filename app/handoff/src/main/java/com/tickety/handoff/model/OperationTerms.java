/*
 * Where: handoff domain model
 * What: what the counterparty is agreeing to, per operation kind
 * Why: amount and token never coexist on one operation
 */
package com.tickety.handoff.model;

import java.util.Objects;

/**
 * A payment carries an amount and never a token; a transfer carries its token and never an amount.
 * Rows that mix the two do not map to either variant.
 */
public sealed interface OperationTerms permits OperationTerms.Payment, OperationTerms.Transfer {

  OperationKind kind();

  static OperationTerms of(OperationKind kind, Long amountCents, String currency, String tokenId) {
    return switch (kind) {
      case PAYMENT -> {
        if (amountCents == null || tokenId != null) {
          throw new IllegalArgumentException("payment terms need an amount and no token");
        }
        yield new Payment(amountCents, currency);
      }
      case TRANSFER -> {
        if (amountCents != null || currency != null) {
          throw new IllegalArgumentException("transfer terms carry no amount");
        }
        yield new Transfer(tokenId);
      }
    };
  }

  record Payment(long amountCents, String currency) implements OperationTerms {

    public Payment {
      if (amountCents <= 0) {
        throw new IllegalArgumentException("amountCents must be positive");
      }
      Objects.requireNonNull(currency, "currency");
    }

    @Override
    public OperationKind kind() {
      return OperationKind.PAYMENT;
    }
  }

  record Transfer(String tokenId) implements OperationTerms {

    public Transfer {
      Objects.requireNonNull(tokenId, "tokenId");
    }

    @Override
    public OperationKind kind() {
      return OperationKind.TRANSFER;
    }
  }
}
