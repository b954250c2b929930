package com.tickety.handoff.model;

import java.time.Instant;

public record IdempotencyRecord(
    String idempotencyKey,
    String requestHash,
    int responseCode,
    String responseBodyJson,
    Instant expiresAt) {}
