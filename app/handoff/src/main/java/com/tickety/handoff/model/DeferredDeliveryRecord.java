/*
 * Where: handoff domain model
 * What: a ticket handed to an email address that has no account yet
 * Why: the ticket is bound to the actor created on that address's first login
 */
package com.tickety.handoff.model;

import java.time.Instant;
import java.util.UUID;

public record DeferredDeliveryRecord(
    UUID deliveryId,
    String ticketId,
    String email,
    String initiatorActorId,
    Instant createdAt,
    String boundActorId,
    Instant boundAt) {}
