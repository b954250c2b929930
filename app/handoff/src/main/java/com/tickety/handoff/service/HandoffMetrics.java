/*
 * Where: handoff service layer
 * What: application metrics for handshakes, expiry and the outbox
 * Why: claim outcomes and publish lag are the signals operators alert on
 */
package com.tickety.handoff.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class HandoffMetrics {

  static final String METRIC_TOKEN_ISSUE_TOTAL = "handoff.token.issue.total";
  static final String METRIC_CLAIM_TOTAL = "handoff.claim.total";
  static final String METRIC_TRANSITION_TOTAL = "handoff.operation.transition.total";
  static final String METRIC_EXPIRED_TOTAL = "handoff.expiry.expired.total";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "handoff.outbox.publish.delay";
  private static final String METRIC_OUTBOX_BACKLOG_AGE = "handoff.outbox.backlog.age";
  private static final String METRIC_OUTBOX_FAILED_CURRENT = "handoff.outbox.failed.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger outboxFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer outboxPublishDelayTimer;
  private final Timer outboxBacklogAgeTimer;

  public HandoffMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicInteger::get)
        .description("Current number of FAILED outbox events")
        .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from outbox insert to JetStream acknowledgement")
            .register(meterRegistry);
    this.outboxBacklogAgeTimer =
        Timer.builder(METRIC_OUTBOX_BACKLOG_AGE)
            .description("Age of an outbox event when the publisher claims it")
            .register(meterRegistry);
  }

  public void recordTokenIssue(Enum<?> outcome) {
    increment(METRIC_TOKEN_ISSUE_TOTAL, "Transfer token issue attempts", "outcome", tag(outcome));
  }

  public void recordClaim(Enum<?> outcome) {
    increment(METRIC_CLAIM_TOTAL, "Claim attempts by outcome", "outcome", tag(outcome));
  }

  public void recordTransition(Enum<?> targetState) {
    increment(
        METRIC_TRANSITION_TOTAL, "Applied operation transitions", "state", tag(targetState));
  }

  public void recordExpired(String resource, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_EXPIRED_TOTAL, "Operations and tokens expired by the relay", "resource", resource)
        .increment(count);
  }

  public void recordOutboxPublishDelay(Instant createdAt, Instant publishedAt) {
    if (createdAt == null || publishedAt == null || publishedAt.isBefore(createdAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(createdAt, publishedAt));
  }

  public void recordOutboxBacklogAge(Instant createdAt, Instant observedAt) {
    if (createdAt == null || observedAt == null || observedAt.isBefore(createdAt)) {
      return;
    }
    outboxBacklogAgeTimer.record(Duration.between(createdAt, observedAt));
  }

  public void updateOutboxFailedCurrent(int failedCount) {
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counter(name, description, tagKey, tagValue).increment();
  }

  private Counter counter(String name, String description, String tagKey, String tagValue) {
    return counters.computeIfAbsent(
        name + ":" + tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }

  private static String tag(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
