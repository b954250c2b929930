package com.tickety.handoff.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "handoff.retention")
public record HandoffRetentionProperties(boolean enabled, Duration cleanupInterval) {}
