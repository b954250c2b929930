package com.tickety.handoff.service;

import java.time.Instant;
import java.util.UUID;

/** Published inside the creating transaction; listeners act after commit. */
public record OperationCreatedEvent(UUID operationId, Instant expiresAt) {}
