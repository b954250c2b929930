package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueTokenRequest(
    @NotBlank(message = "ticket_id is required") String ticketId,
    @Positive(message = "ttl_seconds must be positive") Long ttlSeconds) {}
