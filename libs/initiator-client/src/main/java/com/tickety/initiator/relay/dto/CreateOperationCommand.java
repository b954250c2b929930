package com.tickety.initiator.relay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateOperationCommand(
    String kind,
    String counterpartyActorId,
    String subjectRef,
    Long amountCents,
    String currency,
    Long ttlSeconds) {

  public static CreateOperationCommand payment(
      String counterpartyActorId,
      String orderRef,
      long amountCents,
      String currency,
      Duration ttl) {
    return new CreateOperationCommand(
        "PAYMENT", counterpartyActorId, orderRef, amountCents, currency, seconds(ttl));
  }

  public static CreateOperationCommand transfer(
      String counterpartyActorId, String ticketId, Duration ttl) {
    return new CreateOperationCommand(
        "TRANSFER", counterpartyActorId, ticketId, null, null, seconds(ttl));
  }

  private static Long seconds(Duration ttl) {
    return ttl == null ? null : ttl.toSeconds();
  }
}
