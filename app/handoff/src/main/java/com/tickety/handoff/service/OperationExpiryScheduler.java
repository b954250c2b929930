/*
 * Where: handoff service layer
 * What: one expiry alarm per created operation, fired at its expiresAt
 * Why: operations expire on time without waiting for the next sweep
 */
package com.tickety.handoff.service;

import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Alarms live in memory only; after a restart the periodic sweep in {@link ExpiryWorker} picks up
 * whatever was due.
 */
@Component
@ConditionalOnProperty(
    name = "handoff.expiry.alarms-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class OperationExpiryScheduler {

  private static final Logger logger = LoggerFactory.getLogger(OperationExpiryScheduler.class);

  private final TaskScheduler taskScheduler;
  private final ExpiryEnforcer expiryEnforcer;
  private final ConcurrentMap<UUID, ScheduledFuture<?>> alarms = new ConcurrentHashMap<>();

  public OperationExpiryScheduler(TaskScheduler taskScheduler, ExpiryEnforcer expiryEnforcer) {
    this.taskScheduler = taskScheduler;
    this.expiryEnforcer = expiryEnforcer;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOperationCreated(OperationCreatedEvent event) {
    schedule(event.operationId(), event.expiresAt());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOperationClosed(OperationClosedEvent event) {
    cancel(event.operationId());
  }

  public void schedule(UUID operationId, Instant expiresAt) {
    final ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(operationId), expiresAt);
    final ScheduledFuture<?> previous = alarms.put(operationId, future);
    if (previous != null) {
      previous.cancel(false);
    }
  }

  public void cancel(UUID operationId) {
    final ScheduledFuture<?> future = alarms.remove(operationId);
    if (future != null) {
      future.cancel(false);
    }
  }

  @VisibleForTesting
  int pendingAlarms() {
    return alarms.size();
  }

  @VisibleForTesting
  void fire(UUID operationId) {
    alarms.remove(operationId);
    try {
      if (expiryEnforcer.expireIfDue(operationId)) {
        logger.info("pending operation expired by alarm operationId={}", operationId);
      }
    } catch (RuntimeException ex) {
      // the sweep retries anything the alarm could not finish
      logger.warn("expiry alarm failed operationId={}", operationId, ex);
    }
  }

  @PreDestroy
  public void shutdown() {
    alarms.values().forEach(future -> future.cancel(false));
    alarms.clear();
  }
}
