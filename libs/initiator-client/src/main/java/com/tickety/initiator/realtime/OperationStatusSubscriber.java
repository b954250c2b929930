/*
 * Where: initiator client realtime
 * What: follows one operation through an ordered JetStream consumer plus the relay snapshot
 * Why: the initiator device learns the outcome without polling, and a resubscribe after a
 *      reconnect still starts from the current state
 */
package com.tickety.initiator.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickety.common.event.OperationStateChangedPayload;
import com.tickety.initiator.config.RealtimeProperties;
import com.tickety.initiator.relay.RelayClient;
import com.tickety.initiator.relay.RelayIntegrationException;
import com.tickety.initiator.relay.dto.OperationSnapshot;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OperationStatusSubscriber implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(OperationStatusSubscriber.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "the NATS Connection is an externally managed shared resource")
  private final Connection connection;

  private final RelayClient relayClient;
  private final RealtimeProperties properties;
  private final ObjectMapper objectMapper;
  private final Dispatcher dispatcher;

  public OperationStatusSubscriber(
      Connection connection,
      RelayClient relayClient,
      RealtimeProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.relayClient = relayClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.dispatcher = connection.createDispatcher();
  }

  /**
   * Subscribes before fetching the snapshot so no transition in between is missed; events the
   * snapshot already covers are dropped by sequence.
   */
  public OperationSubscription subscribe(String operationId, String viewerActorId) {
    final OperationSubscription subscription = new OperationSubscription(operationId);
    final String subject = properties.subject(operationId);
    final JetStreamSubscription jetStreamSubscription;
    try {
      jetStreamSubscription =
          connection
              .jetStream()
              .subscribe(
                  subject,
                  dispatcher,
                  message -> handleMessage(subscription, message),
                  false,
                  PushSubscribeOptions.builder().stream(properties.stream()).ordered(true).build());
    } catch (IOException | JetStreamApiException ex) {
      throw new RelayIntegrationException(
          RelayIntegrationException.Reason.BAD_GATEWAY, "realtime subscription failed", ex);
    }
    subscription.attach(
        () -> {
          dispatcher.unsubscribe(jetStreamSubscription);
          logger.debug("realtime subscription released operationId={}", operationId);
        });

    subscription.attachRefresher(
        () -> OperationUpdate.fromSnapshot(relayClient.snapshot(operationId, viewerActorId)));

    final OperationSnapshot snapshot;
    try {
      snapshot = relayClient.snapshot(operationId, viewerActorId);
    } catch (RuntimeException ex) {
      subscription.close();
      throw ex;
    }
    subscription.deliverSnapshot(OperationUpdate.fromSnapshot(snapshot));
    logger.info(
        "realtime subscription started operationId={} subject={} state={} sequence={}",
        operationId,
        subject,
        snapshot.state(),
        snapshot.sequence());
    return subscription;
  }

  void handleMessage(OperationSubscription subscription, Message message) {
    final OperationStateChangedPayload payload;
    try {
      payload = objectMapper.readValue(message.getData(), OperationStateChangedPayload.class);
    } catch (IOException ex) {
      logger.warn(
          "realtime event parse failed operationId={} subject={}",
          subscription.operationId(),
          message.getSubject(),
          ex);
      return;
    }
    if (!subscription.operationId().equals(payload.operationId())) {
      logger.warn(
          "realtime event for another operation dropped expected={} actual={}",
          subscription.operationId(),
          payload.operationId());
      return;
    }
    final OperationUpdate update;
    try {
      update = OperationUpdate.fromEvent(payload);
    } catch (IllegalArgumentException ex) {
      logger.warn(
          "realtime event with unknown state dropped operationId={} state={}",
          payload.operationId(),
          payload.state());
      return;
    }
    subscription.onEvent(update);
  }

  @Override
  public void close() {
    connection.closeDispatcher(dispatcher);
  }
}
