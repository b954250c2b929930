/*
 * Where: initiator client configuration
 * What: relay base URL, request headers and the retry policy of device-side calls
 * Why: each deployment points devices at its own relay and tunes retries for its network
 */
package com.tickety.initiator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay")
public record RelayClientProperties(
    String baseUrl,
    String actorIdHeaderName,
    String idempotencyKeyHeaderName,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffJitterMin,
    double backoffJitterMax) {

  public RelayClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://handoff:8080" : baseUrl;
    actorIdHeaderName =
        actorIdHeaderName == null || actorIdHeaderName.isBlank() ? "X-Actor-Id" : actorIdHeaderName;
    idempotencyKeyHeaderName =
        idempotencyKeyHeaderName == null || idempotencyKeyHeaderName.isBlank()
            ? "Idempotency-Key"
            : idempotencyKeyHeaderName;
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    backoffBase = backoffBase == null ? Duration.ofMillis(200) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofSeconds(2) : backoffMax;
    backoffJitterMin = backoffJitterMin <= 0 ? 0.5 : backoffJitterMin;
    backoffJitterMax = backoffJitterMax <= 0 ? 1.0 : backoffJitterMax;
    if (backoffJitterMax < backoffJitterMin) {
      throw new IllegalArgumentException("relay.backoff-jitter-max must be >= backoff-jitter-min");
    }
  }
}
