package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompleteOperationRequest(
    @NotBlank(message = "charge_ref is required")
        @Size(max = 128, message = "charge_ref is too long")
        String chargeRef) {}
