/*
 * Where: handoff expiry worker
 * What: runs the expiry sweep on a fixed delay
 * Why: the backstop for alarms lost on restart
 */
package com.tickety.handoff.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "handoff.expiry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ExpiryWorker {

  private final ExpiryEnforcer expiryEnforcer;

  @Scheduled(fixedDelayString = "${handoff.expiry.sweep-interval}")
  public void run() {
    expiryEnforcer.sweep();
  }
}
