/*
 * Where: handoff configuration binding
 * What: expiry alarm and sweep settings
 * Why: alarms fire per operation and the sweep is the backstop after restarts
 */
package com.tickety.handoff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "handoff.expiry")
public record HandoffExpiryProperties(
    boolean enabled, boolean alarmsEnabled, Duration sweepInterval, int batchSize) {}
