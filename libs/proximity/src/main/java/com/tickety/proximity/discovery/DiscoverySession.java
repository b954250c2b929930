/*
 * Where: proximity discovery
 * What: one cancellable listening session feeding decoded payloads into a channel
 * Why: the state-machine driver consumes payloads from a queue instead of radio callbacks
 */
package com.tickety.proximity.discovery;

import com.google.common.annotations.VisibleForTesting;
import com.tickety.proximity.DecodeResult;
import com.tickety.proximity.PayloadKind;
import com.tickety.proximity.ProximityPayload;
import com.tickety.proximity.ProximityPayloadCodec;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running discovery loop. Closing the session stops reading from the transport; it never
 * touches any relay operation that was created from a payload it delivered.
 */
public final class DiscoverySession implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(DiscoverySession.class);
  static final int MAX_CONSECUTIVE_FAULTS = 5;

  private final ProximityTransport transport;
  private final ProximityPayloadCodec codec;
  private final PayloadKind expectedKind;
  private final Duration pollTimeout;
  private final BlockingQueue<ProximityPayload> channel;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicLong malformedFrames = new AtomicLong();
  private final AtomicLong droppedFrames = new AtomicLong();
  private final AtomicLong transportFaults = new AtomicLong();
  private volatile Future<?> task;

  DiscoverySession(
      ProximityTransport transport,
      ProximityPayloadCodec codec,
      PayloadKind expectedKind,
      Duration pollTimeout,
      int channelCapacity) {
    this.transport = transport;
    this.codec = codec;
    this.expectedKind = expectedKind;
    this.pollTimeout = pollTimeout;
    this.channel = new LinkedBlockingQueue<>(channelCapacity);
  }

  void start(ExecutorService executor) {
    task = executor.submit(this::readLoop);
  }

  /** Waits for the next accepted payload. Empty on timeout or once the session is closed. */
  public Optional<ProximityPayload> next(Duration timeout) throws InterruptedException {
    if (closed.get() && channel.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(channel.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    final Future<?> running = task;
    if (running != null) {
      running.cancel(true);
    }
    logger.debug(
        "proximity discovery closed kind={} malformed={} dropped={}",
        expectedKind,
        malformedFrames.get(),
        droppedFrames.get());
  }

  @VisibleForTesting
  long malformedFrames() {
    return malformedFrames.get();
  }

  @VisibleForTesting
  long transportFaults() {
    return transportFaults.get();
  }

  /**
   * A failed read is logged and the loop keeps listening. After {@link #MAX_CONSECUTIVE_FAULTS}
   * failures in a row the session closes itself, so callers waiting on {@link #next(Duration)} see
   * {@link #isClosed()} and fall back to QR or email.
   */
  private void readLoop() {
    int consecutiveFaults = 0;
    while (!closed.get() && !Thread.currentThread().isInterrupted()) {
      final byte[] frame;
      try {
        frame = transport.receive(pollTimeout);
        consecutiveFaults = 0;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      } catch (RuntimeException ex) {
        transportFaults.incrementAndGet();
        consecutiveFaults++;
        if (consecutiveFaults >= MAX_CONSECUTIVE_FAULTS) {
          logger.warn(
              "proximity transport keeps failing; discovery closed kind={} faults={}",
              expectedKind,
              consecutiveFaults,
              ex);
          close();
          return;
        }
        logger.warn(
            "proximity transport read failed kind={} consecutiveFaults={}",
            expectedKind,
            consecutiveFaults,
            ex);
        continue;
      }
      if (frame != null) {
        accept(frame);
      }
    }
  }

  private void accept(byte[] frame) {
    final DecodeResult result = codec.decode(frame);
    if (result.isMalformed()) {
      // A bad read is routine on a radio channel; keep listening.
      malformedFrames.incrementAndGet();
      logger.debug("proximity frame ignored reason={}", result.malformedReason());
      return;
    }
    final ProximityPayload payload = result.payload();
    if (payload.kind() != expectedKind) {
      logger.debug("proximity frame ignored kind={} expected={}", payload.kind(), expectedKind);
      return;
    }
    if (!channel.offer(payload)) {
      droppedFrames.incrementAndGet();
      logger.debug("proximity channel full; frame dropped kind={}", payload.kind());
    }
  }
}
