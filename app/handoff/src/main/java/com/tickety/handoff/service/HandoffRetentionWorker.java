/*
 * Where: handoff retention worker
 * What: schedules the retention cleanup
 * Why: keep retention off the request path
 */
package com.tickety.handoff.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "handoff.retention.enabled", havingValue = "true")
public class HandoffRetentionWorker {

  private final HandoffRetentionService retentionService;

  @Scheduled(fixedDelayString = "${handoff.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
