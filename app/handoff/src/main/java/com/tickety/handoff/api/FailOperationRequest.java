package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** A blank reason is recorded as {@code counterparty_reported}; long reasons are truncated. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailOperationRequest(String reason) {}
