/*
 * Where: handoff relay entry point
 * What: boots Spring and enables configuration scanning and scheduling
 * Why: the relay runs the expiry sweep and outbox publisher as scheduled jobs
 */
package com.tickety.handoff;

import com.tickety.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class HandoffApplication {

  public static void main(String[] args) {
    SpringApplication.run(HandoffApplication.class, args);
  }
}
