/*
 * Where: handoff NATS integration
 * What: sends one outbox event to the broker and waits for its acknowledgement
 * Why: the outbox publisher stays the same whether or not a broker is configured
 */
package com.tickety.handoff.nats;

import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;

public interface HandoffEventTransport {

  /**
   * Returns normally only once the event is durably accepted; a JetStream publish returns after
   * the PubAck.
   */
  void publish(String subject, Headers headers, byte[] body)
      throws IOException, JetStreamApiException;
}
