/*
 * Where: handoff configuration binding
 * What: validity window bounds for transfer tokens
 * Why: in-person handoffs use short windows that each deployment tunes
 */
package com.tickety.handoff.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "handoff.token")
public record HandoffTokenProperties(
    @NotNull Duration defaultTtl, @NotNull Duration minTtl, @NotNull Duration maxTtl) {

  /** Requested TTL clamped to the configured bounds; the default when none was requested. */
  public Duration resolveTtl(Duration requested) {
    return TtlBounds.clamp(requested, defaultTtl, minTtl, maxTtl);
  }
}
