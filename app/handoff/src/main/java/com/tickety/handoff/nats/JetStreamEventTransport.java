/*
 * Where: handoff NATS integration
 * What: publishes outbox events to JetStream
 * Why: Nats-Msg-Id plus the stream duplicate window drop republished events
 */
package com.tickety.handoff.nats;

import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class JetStreamEventTransport implements HandoffEventTransport {

  private static final Logger logger = LoggerFactory.getLogger(JetStreamEventTransport.class);

  private final JetStream jetStream;

  @Override
  public void publish(String subject, Headers headers, byte[] body)
      throws IOException, JetStreamApiException {
    final PublishAck ack = jetStream.publish(subject, headers, body);
    if (ack == null) {
      throw new IllegalStateException("puback is missing");
    }
    if (ack.isDuplicate()) {
      logger.debug("jetstream dropped duplicate subject={} seq={}", subject, ack.getSeqno());
    }
  }
}
