/*
 * Where: initiator client relay calls
 * What: capped exponential backoff with jitter between retried relay calls
 * Why: many devices at one venue must not retry in lockstep after a relay hiccup
 */
package com.tickety.initiator.relay;

import com.tickety.initiator.config.RelayClientProperties;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public final class RetryBackoff {

  private static final double EXPONENT_BASE = 2.0;

  private final Duration base;
  private final Duration max;
  private final double jitterMin;
  private final double jitterMax;

  public RetryBackoff(Duration base, Duration max, double jitterMin, double jitterMax) {
    this.base = base;
    this.max = max;
    this.jitterMin = jitterMin;
    this.jitterMax = jitterMax;
  }

  public static RetryBackoff from(RelayClientProperties properties) {
    return new RetryBackoff(
        properties.backoffBase(),
        properties.backoffMax(),
        properties.backoffJitterMin(),
        properties.backoffJitterMax());
  }

  /** Delay before the attempt following {@code attempt}; attempts start at 1. */
  public Duration delay(int attempt) {
    final double exp = base.toMillis() * Math.pow(EXPONENT_BASE, attempt - 1);
    final double capped = Math.min(exp, max.toMillis());
    final double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }
}
