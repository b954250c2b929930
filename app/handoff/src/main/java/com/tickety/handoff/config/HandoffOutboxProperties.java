/*
 * Where: handoff configuration binding
 * What: outbox polling, lease and retry settings
 * Why: publish cadence and backoff are operational tunables
 */
package com.tickety.handoff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "handoff.outbox")
public record HandoffOutboxProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    Duration lease,
    Duration publishedTtl) {}
