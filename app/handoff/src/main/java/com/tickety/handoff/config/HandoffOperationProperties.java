/*
 * Where: handoff configuration binding
 * What: validity window bounds and limits for pending operations
 * Why: operations expire on the relay clock, so the window is a deployment tunable
 */
package com.tickety.handoff.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "handoff.operation")
public record HandoffOperationProperties(
    @NotNull Duration defaultTtl,
    @NotNull Duration minTtl,
    @NotNull Duration maxTtl,
    @Positive int failureReasonMaxLength) {

  public Duration resolveTtl(Duration requested) {
    return TtlBounds.clamp(requested, defaultTtl, minTtl, maxTtl);
  }
}
