/*
 * Where: handoff configuration binding
 * What: JetStream stream and subjects used for realtime status and deferred delivery events
 * Why: the stream must cover every subject so Nats-Msg-Id deduplication applies
 */
package com.tickety.handoff.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "handoff.nats")
public record HandoffNatsProperties(
    @NotBlank String operationSubjectPrefix,
    @NotBlank String deliverySubject,
    @NotBlank String stream,
    @NotNull Duration duplicateWindow) {

  /** Subject carrying the state changes of a single operation. */
  public String operationSubject(String operationId) {
    return operationSubjectPrefix + "." + operationId;
  }

  public String operationSubjectWildcard() {
    return operationSubjectPrefix + ".>";
  }
}
