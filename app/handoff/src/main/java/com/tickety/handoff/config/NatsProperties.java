/*
 * Where: handoff configuration binding
 * What: NATS connection settings
 * Why: the broker can be switched off for local runs and tests
 */
package com.tickety.handoff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
