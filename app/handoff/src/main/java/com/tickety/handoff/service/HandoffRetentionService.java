/*
 * Where: handoff retention service
 * What: deletes expired idempotency keys and old published outbox rows
 * Why: both tables grow with every request and only recent rows are read
 */
package com.tickety.handoff.service;

import com.tickety.handoff.config.HandoffOutboxProperties;
import com.tickety.handoff.repository.IdempotencyKeyRepository;
import com.tickety.handoff.repository.OutboxEventRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HandoffRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(HandoffRetentionService.class);

  private final IdempotencyKeyRepository idempotencyKeyRepository;
  private final OutboxEventRepository outboxEventRepository;
  private final HandoffOutboxProperties outboxProperties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final int deletedIdempotency = idempotencyKeyRepository.deleteExpired(now);
    // only PUBLISHED rows age out; pending and failed rows stay
    final Instant outboxThreshold = now.minus(outboxProperties.publishedTtl());
    final int deletedOutbox = outboxEventRepository.deletePublishedOlderThan(outboxThreshold);
    logger.info(
        "handoff retention cleanup deleted idempotencyKeys={} outboxEvents={}"
            + " outboxThreshold={} idempotencyThreshold={}",
        deletedIdempotency,
        deletedOutbox,
        outboxThreshold,
        now);
  }
}
