package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailHandoffRequest(
    @NotBlank(message = "ticket_id is required") String ticketId,
    @NotBlank(message = "email is required") @Email(message = "email is invalid") String email) {}
