/*
 * Where: handoff configuration binding
 * What: TTL of stored Idempotency-Key responses
 * Why: retention must outlive any client retry window
 */
package com.tickety.handoff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "handoff.idempotency")
public record HandoffIdempotencyProperties(long ttlHours) {}
