/*
 * Where: initiator client configuration
 * What: JetStream stream and subject prefix of realtime operation status
 * Why: the relay and its devices must agree on where status events live
 */
package com.tickety.initiator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay.realtime")
public record RealtimeProperties(boolean enabled, String stream, String subjectPrefix) {

  public RealtimeProperties {
    stream = stream == null || stream.isBlank() ? "handoff-events" : stream;
    subjectPrefix =
        subjectPrefix == null || subjectPrefix.isBlank() ? "handoff.operations" : subjectPrefix;
  }

  public String subject(String operationId) {
    return subjectPrefix + "." + operationId;
  }
}
