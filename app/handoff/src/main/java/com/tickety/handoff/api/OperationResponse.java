package com.tickety.handoff.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.model.OperationTerms;
import com.tickety.handoff.model.PendingOperationRecord;
import com.tickety.handoff.model.TransferTokenRecord;
import java.time.Instant;

/**
 * Snapshot of an operation. {@code sequence} matches the realtime event sequence, so a subscriber
 * can discard events it has already seen. {@code transferToken} is only set in the create response
 * of a transfer.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
    String operationId,
    String kind,
    String state,
    String initiatorActorId,
    String counterpartyActorId,
    String subjectRef,
    Long amountCents,
    String currency,
    String terminalReason,
    String chargeRef,
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt,
    long sequence,
    String transferToken) {

  static OperationResponse from(PendingOperationRecord operation) {
    return from(operation, null);
  }

  static OperationResponse from(PendingOperationRecord operation, TransferTokenRecord token) {
    final OperationTerms.Payment payment =
        operation.terms() instanceof OperationTerms.Payment terms ? terms : null;
    return new OperationResponse(
        operation.operationId().toString(),
        operation.kind().name(),
        operation.state().name(),
        operation.initiatorActorId(),
        operation.counterpartyActorId(),
        operation.subjectRef(),
        payment == null ? null : payment.amountCents(),
        payment == null ? null : payment.currency(),
        operation.terminalReason(),
        operation.chargeRef(),
        operation.createdAt(),
        operation.updatedAt(),
        operation.expiresAt(),
        operation.version(),
        token == null ? null : token.tokenId());
  }
}
