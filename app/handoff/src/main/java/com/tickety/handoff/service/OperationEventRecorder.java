/*
 * Where: handoff service layer
 * What: writes realtime events into the outbox inside the caller's transaction
 * Why: a state change and its event commit or roll back together
 */
package com.tickety.handoff.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickety.common.TraceIds;
import com.tickety.common.event.DeferredDeliveryPayload;
import com.tickety.common.event.OperationStateChangedPayload;
import com.tickety.handoff.config.HandoffNatsProperties;
import com.tickety.handoff.model.DeferredDeliveryRecord;
import com.tickety.handoff.model.PendingOperationRecord;
import com.tickety.handoff.repository.OutboxEventRepository;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class OperationEventRecorder {

  static final String DELIVERY_AGGREGATE_PREFIX = "delivery:";

  private final OutboxEventRepository outboxEventRepository;
  private final HandoffNatsProperties natsProperties;
  private final ObjectMapper objectMapper;

  /** One event per transition; the operation version is the event sequence. */
  @Transactional(propagation = Propagation.MANDATORY)
  public void recordStateChange(PendingOperationRecord operation) {
    final UUID eventId = UUID.randomUUID();
    final String operationId = operation.operationId().toString();
    final OperationStateChangedPayload payload =
        new OperationStateChangedPayload(
            eventId.toString(),
            operationId,
            operation.kind().name(),
            operation.state().name(),
            operation.terminalReason(),
            operation.updatedAt().toString(),
            operation.version(),
            resolveTraceId());
    outboxEventRepository.insert(
        eventId,
        OperationStateChangedPayload.EVENT_TYPE,
        operationId,
        operation.version(),
        natsProperties.operationSubject(operationId),
        toJson(payload),
        operation.updatedAt());
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void recordDeferredDelivery(DeferredDeliveryRecord delivery) {
    final UUID eventId = UUID.randomUUID();
    final DeferredDeliveryPayload payload =
        new DeferredDeliveryPayload(
            eventId.toString(),
            delivery.deliveryId().toString(),
            delivery.ticketId(),
            delivery.email(),
            delivery.initiatorActorId(),
            delivery.createdAt().toString(),
            resolveTraceId());
    outboxEventRepository.insert(
        eventId,
        DeferredDeliveryPayload.EVENT_TYPE,
        DELIVERY_AGGREGATE_PREFIX + delivery.deliveryId(),
        1L,
        natsProperties.deliverySubject(),
        toJson(payload),
        delivery.createdAt());
  }

  private String toJson(Object payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize outbox payload", ex);
    }
  }

  private String resolveTraceId() {
    final String traceId = MDC.get("trace_id");
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    return TraceIds.resolve(MDC.get("traceId"));
  }
}
