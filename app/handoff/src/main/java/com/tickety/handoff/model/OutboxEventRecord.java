package com.tickety.handoff.model;

import java.time.Instant;
import java.util.UUID;

public record OutboxEventRecord(
    UUID eventId,
    String eventType,
    String aggregateKey,
    long sequence,
    String subject,
    String payloadJson,
    int attemptCount,
    Instant createdAt) {}
