/*
 * Where: initiator client state machine
 * What: drives one handshake on the vendor or holder device from WAITING to a terminal state
 * Why: discovery, the relay call and the realtime channel have to be opened and closed together
 */
package com.tickety.initiator;

import com.tickety.initiator.realtime.OperationStatusSubscriber;
import com.tickety.initiator.realtime.OperationSubscription;
import com.tickety.initiator.realtime.OperationUpdate;
import com.tickety.initiator.relay.RelayClient;
import com.tickety.initiator.relay.RelayIntegrationException;
import com.tickety.initiator.relay.dto.CancelResult;
import com.tickety.initiator.relay.dto.OperationSnapshot;
import com.tickety.proximity.PayloadKind;
import com.tickety.proximity.ProximityFormat;
import com.tickety.proximity.ProximityPayload;
import com.tickety.proximity.discovery.DiscoverySession;
import com.tickety.proximity.discovery.ProximityBroadcaster;
import com.tickety.proximity.discovery.ProximityDiscovery;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One handshake, not thread-safe: a single device thread calls it. Payments start by discovering
 * the customer's identity broadcast; transfers start by broadcasting the claim token. In both cases
 * the outcome arrives through the realtime subscription.
 */
public final class InitiatorSession implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(InitiatorSession.class);
  static final Duration DEFAULT_RESYNC_INTERVAL = Duration.ofSeconds(5);

  private final String initiatorActorId;
  private final RelayClient relayClient;
  private final OperationStatusSubscriber subscriber;
  private final ProximityDiscovery discovery;
  private final ProximityBroadcaster broadcaster;
  private final Duration resyncInterval;

  private HandoffState state = HandoffState.WAITING;
  private String terminalReason;
  private OperationSnapshot operation;
  private DiscoverySession discoverySession;
  private OperationSubscription subscription;

  public InitiatorSession(
      String initiatorActorId,
      RelayClient relayClient,
      OperationStatusSubscriber subscriber,
      ProximityDiscovery discovery,
      ProximityBroadcaster broadcaster) {
    this(
        initiatorActorId,
        relayClient,
        subscriber,
        discovery,
        broadcaster,
        DEFAULT_RESYNC_INTERVAL);
  }

  /**
   * @param resyncInterval how long {@link #awaitOutcome(Duration)} waits on a quiet realtime channel
   *     before it re-reads the relay snapshot
   */
  public InitiatorSession(
      String initiatorActorId,
      RelayClient relayClient,
      OperationStatusSubscriber subscriber,
      ProximityDiscovery discovery,
      ProximityBroadcaster broadcaster,
      Duration resyncInterval) {
    if (resyncInterval == null || resyncInterval.isNegative() || resyncInterval.isZero()) {
      throw new IllegalArgumentException("resyncInterval must be positive");
    }
    this.initiatorActorId = initiatorActorId;
    this.relayClient = relayClient;
    this.subscriber = subscriber;
    this.discovery = discovery;
    this.broadcaster = broadcaster;
    this.resyncInterval = resyncInterval;
  }

  public HandoffState state() {
    return state;
  }

  public Optional<String> terminalReason() {
    return Optional.ofNullable(terminalReason);
  }

  public Optional<OperationSnapshot> operation() {
    return Optional.ofNullable(operation);
  }

  /**
   * Waits for a customer identity broadcast.
   *
   * @return the customer's actor id; empty on timeout or when no proximity transport is available,
   *     in which case the vendor falls back to a QR code or email lookup
   */
  public Optional<String> discoverCustomer(Duration timeout) throws InterruptedException {
    requireState(HandoffState.WAITING);
    if (discoverySession == null) {
      final Optional<DiscoverySession> opened = discovery.open(PayloadKind.CUSTOMER_IDENTITY);
      if (opened.isEmpty()) {
        return Optional.empty();
      }
      discoverySession = opened.get();
    }
    return discoverySession.next(timeout).map(ProximityPayload::subjectId);
  }

  public OperationSnapshot requestPayment(
      String customerActorId, String orderRef, long amountCents, String currency, Duration ttl) {
    requireState(HandoffState.WAITING);
    closeDiscovery();
    final OperationSnapshot created =
        relayClient.createPayment(
            initiatorActorId, customerActorId, orderRef, amountCents, currency, ttl);
    follow(created);
    return created;
  }

  /**
   * Creates the transfer and broadcasts its claim token.
   *
   * @return false when nothing is broadcasting; the caller shows the token as a QR code instead
   */
  public boolean offerTransfer(
      String ticketId, String counterpartyActorId, ProximityFormat format, Duration ttl) {
    requireState(HandoffState.WAITING);
    closeDiscovery();
    final OperationSnapshot created =
        relayClient.createTransfer(initiatorActorId, counterpartyActorId, ticketId, ttl);
    if (created.transferToken() == null) {
      throw new IllegalStateException("relay returned a transfer without a token");
    }
    follow(created);
    if (state.isTerminal()) {
      return false;
    }
    return broadcaster.start(
        ProximityPayload.ticketClaim(created.transferToken(), created.operationId()), format);
  }

  /** Applies the next update, if one arrives within {@code timeout}. */
  public Optional<OperationUpdate> awaitUpdate(Duration timeout) throws InterruptedException {
    if (subscription == null) {
      throw new IllegalStateException("no operation has been created");
    }
    final Optional<OperationUpdate> update = subscription.next(timeout);
    update.ifPresent(this::apply);
    return update;
  }

  /**
   * Reads updates until a terminal state arrives or {@code timeout} elapses. Whenever the channel
   * stays quiet for the resync interval the relay snapshot is read again.
   */
  public HandoffState awaitOutcome(Duration timeout) throws InterruptedException {
    final long deadline = System.nanoTime() + timeout.toNanos();
    while (!state.isTerminal()) {
      final long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        break;
      }
      final Duration slice = Duration.ofNanos(Math.min(remaining, resyncInterval.toNanos()));
      if (awaitUpdate(slice).isPresent()) {
        continue;
      }
      if (subscription.isClosed()) {
        break;
      }
      resync();
    }
    return state;
  }

  public CancelResult cancel() {
    if (operation == null) {
      throw new IllegalStateException("no operation has been created");
    }
    final CancelResult result = relayClient.cancel(operation.operationId(), initiatorActorId);
    if (result.operation() != null) {
      apply(OperationUpdate.fromSnapshot(result.operation()));
    }
    logger.info(
        "initiator cancel operationId={} status={}", operation.operationId(), result.status());
    return result;
  }

  public String outcomeMessage() {
    return OutcomeMessages.forState(state, terminalReason);
  }

  @Override
  public void close() {
    closeDiscovery();
    broadcaster.stop();
    if (subscription != null) {
      subscription.close();
    }
  }

  private void follow(OperationSnapshot created) {
    operation = created;
    state = HandoffState.fromWire(created.state());
    subscription = subscriber.subscribe(created.operationId(), initiatorActorId);
  }

  private void apply(OperationUpdate update) {
    if (state.isTerminal()) {
      return;
    }
    state = update.state();
    if (state.isTerminal()) {
      terminalReason = update.terminalReason();
      closeDiscovery();
      broadcaster.stop();
      if (subscription != null) {
        subscription.close();
      }
      logger.info(
          "initiator outcome operationId={} state={} reason={}",
          update.operationId(),
          state,
          terminalReason);
    }
  }

  private void resync() {
    try {
      if (subscription.refresh()) {
        logger.info("initiator resynced from snapshot operationId={}", subscription.operationId());
      }
    } catch (RelayIntegrationException ex) {
      logger.warn(
          "initiator snapshot resync failed operationId={} reason={}",
          subscription.operationId(),
          ex.reason(),
          ex);
    }
  }

  private void closeDiscovery() {
    if (discoverySession != null) {
      discoverySession.close();
      discoverySession = null;
    }
  }

  private void requireState(HandoffState expected) {
    if (state != expected) {
      throw new IllegalStateException("session is " + state + ", expected " + expected);
    }
  }
}
