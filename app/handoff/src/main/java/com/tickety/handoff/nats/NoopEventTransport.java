/*
 * Where: handoff NATS integration
 * What: accepts outbox events without a broker
 * Why: local runs and tests start the service with nats.enabled=false
 */
package com.tickety.handoff.nats;

import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopEventTransport implements HandoffEventTransport {

  private static final Logger logger = LoggerFactory.getLogger(NoopEventTransport.class);

  @Override
  public void publish(String subject, Headers headers, byte[] body) {
    logger.debug("nats disabled; event dropped subject={} bytes={}", subject, body.length);
  }
}
