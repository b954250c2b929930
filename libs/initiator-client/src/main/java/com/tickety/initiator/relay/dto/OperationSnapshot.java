package com.tickety.initiator.relay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** {@code transferToken} is only present in the response that created a transfer. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OperationSnapshot(
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
    String transferToken) {}
