/*
 * Where: handoff outbox worker
 * What: polls the outbox on a fixed delay
 * Why: state changes reach subscribers even when the broker was down at commit time
 */
package com.tickety.handoff.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "handoff.outbox.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class HandoffOutboxWorker {

  private final HandoffOutboxPublisher publisher;

  @Scheduled(fixedDelayString = "${handoff.outbox.poll-interval}")
  public void run() {
    publisher.publishPendingBatch();
  }
}
