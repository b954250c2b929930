/*
 * Where: shared realtime event schema
 * What: notification that a ticket was parked on an email address without an account
 * Why: the mailer invites the recipient, whose first login binds the ticket
 */
package com.tickety.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeferredDeliveryPayload(
    String eventId,
    String deliveryId,
    String ticketId,
    String email,
    String initiatorActorId,
    String createdAt,
    String traceId) {

  public static final String EVENT_TYPE = "TicketDeliveryDeferred";
}
