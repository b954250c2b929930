/*
 * Where: handoff service layer
 * What: expires due operations and tokens in batches
 * Why: expiry must happen even when no client is connected, and twice-run sweeps must not double expire
 */
package com.tickety.handoff.service;

import com.tickety.common.event.OperationStates;
import com.tickety.handoff.config.HandoffExpiryProperties;
import com.tickety.handoff.model.PendingOperationRecord;
import com.tickety.handoff.model.TransferTokenRecord;
import com.tickety.handoff.repository.PendingOperationRepository;
import com.tickety.handoff.repository.TransferTokenRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Batch expiry. Each batch runs in its own transaction and claims rows with {@code FOR UPDATE SKIP
 * LOCKED}, so concurrent sweepers and per-operation alarms split the work instead of repeating it.
 * Operations go first so that a transfer's token is closed together with its operation.
 */
@Service
@RequiredArgsConstructor
public class ExpiryEnforcer {

  private static final Logger logger = LoggerFactory.getLogger(ExpiryEnforcer.class);

  private final PendingOperationRepository operationRepository;
  private final TransferTokenRepository tokenRepository;
  private final PendingOperationRelay relay;
  private final HandoffExpiryProperties properties;
  private final HandoffMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public SweepResult sweep() {
    final int batchSize = properties.batchSize();
    int operations = 0;
    int batch;
    do {
      batch = expireOperationBatch(batchSize);
      operations += batch;
    } while (batch == batchSize);
    int tokens = 0;
    do {
      batch = expireTokenBatch(batchSize);
      tokens += batch;
    } while (batch == batchSize);
    metrics.recordExpired("operation", operations);
    metrics.recordExpired("token", tokens);
    if (operations > 0 || tokens > 0) {
      logger.info("expiry sweep finished operations={} tokens={}", operations, tokens);
    }
    return new SweepResult(operations, tokens);
  }

  /** Alarm path for a single operation. */
  public boolean expireIfDue(UUID operationId) {
    return relay.expireIfDue(operationId);
  }

  private int expireOperationBatch(int batchSize) {
    final Integer expired =
        transactionTemplate.execute(
            status -> {
              final Instant now = Instant.now(clock);
              final List<PendingOperationRecord> due =
                  operationRepository.expireDue(now, OperationStates.REASON_EXPIRED, batchSize);
              due.forEach(operation -> relay.onSweptExpired(operation, now));
              return due.size();
            });
    return expired == null ? 0 : expired;
  }

  private int expireTokenBatch(int batchSize) {
    final Integer expired =
        transactionTemplate.execute(
            status -> {
              final List<TransferTokenRecord> due =
                  tokenRepository.expireDue(Instant.now(clock), batchSize);
              due.forEach(
                  token ->
                      logger.debug(
                          "transfer token expired tokenId={} ticketId={}",
                          token.shortId(),
                          token.ticketId()));
              return due.size();
            });
    return expired == null ? 0 : expired;
  }

  public record SweepResult(int operations, int tokens) {}
}
