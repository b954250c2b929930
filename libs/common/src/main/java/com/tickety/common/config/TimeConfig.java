/*
 * Where: shared configuration
 * What: the relay's authoritative UTC clock, ticking in whole microseconds
 * Why: instants computed in memory compare equal to the ones read back from timestamptz columns
 */
package com.tickety.common.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  static final Duration STORAGE_PRECISION = Duration.ofNanos(1_000);

  @Bean
  public Clock clock() {
    return Clock.tick(Clock.systemUTC(), STORAGE_PRECISION);
  }
}
