package com.tickety.handoff;

import java.time.Instant;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration(proxyBeanMethods = false)
public class MutableClockConfig {

  public static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

  @Bean
  @Primary
  public MutableClock mutableClock() {
    return new MutableClock(START);
  }
}
