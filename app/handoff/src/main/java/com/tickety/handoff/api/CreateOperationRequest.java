package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.model.OperationKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * For {@code TRANSFER} the subject is the ticket id and amount fields must be absent; for {@code
 * PAYMENT} the subject is the vendor's order reference.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateOperationRequest(
    @NotNull(message = "kind is required") OperationKind kind,
    String counterpartyActorId,
    @NotBlank(message = "subject_ref is required") String subjectRef,
    @Positive(message = "amount_cents must be positive") Long amountCents,
    String currency,
    @Positive(message = "ttl_seconds must be positive") Long ttlSeconds) {}
