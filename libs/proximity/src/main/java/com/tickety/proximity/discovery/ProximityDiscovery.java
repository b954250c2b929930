/*
 * Where: proximity discovery
 * What: opens discovery sessions on a transport and owns the listener threads
 * Why: each device runs exactly one task per session that reads the radio and feeds a channel
 */
package com.tickety.proximity.discovery;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.tickety.proximity.PayloadKind;
import com.tickety.proximity.ProximityPayloadCodec;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProximityDiscovery implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ProximityDiscovery.class);
  static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
  static final int DEFAULT_CHANNEL_CAPACITY = 16;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "the transport wraps a device radio and cannot be copied")
  private final ProximityTransport transport;

  private final ProximityPayloadCodec codec;
  private final ExecutorService executor;
  private final Duration pollTimeout;
  private final int channelCapacity;

  public ProximityDiscovery(ProximityTransport transport, ProximityPayloadCodec codec) {
    this(
        transport,
        codec,
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("proximity-discovery-%d")
                .setDaemon(true)
                .build()),
        DEFAULT_POLL_TIMEOUT,
        DEFAULT_CHANNEL_CAPACITY);
  }

  public ProximityDiscovery(
      ProximityTransport transport,
      ProximityPayloadCodec codec,
      ExecutorService executor,
      Duration pollTimeout,
      int channelCapacity) {
    this.transport = transport;
    this.codec = codec;
    this.executor = executor;
    this.pollTimeout = pollTimeout;
    this.channelCapacity = channelCapacity;
  }

  /**
   * Starts listening for payloads of one kind.
   *
   * @return empty when the transport is unavailable, so the caller can switch to the QR or email
   *     fallback
   */
  public Optional<DiscoverySession> open(PayloadKind expectedKind) {
    if (!transport.isAvailable()) {
      logger.info("proximity transport unavailable; fallback required kind={}", expectedKind);
      return Optional.empty();
    }
    final DiscoverySession session =
        new DiscoverySession(transport, codec, expectedKind, pollTimeout, channelCapacity);
    session.start(executor);
    return Optional.of(session);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
