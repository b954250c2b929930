/*
 * Where: initiator client realtime
 * What: the channel of state updates for one operation, snapshot first, then newer events in order
 * Why: a live event can arrive before the snapshot fetch returns and must neither be lost nor
 *      delivered twice
 */
package com.tickety.initiator.realtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers the snapshot, then only events whose sequence is greater than the last delivered one.
 * After a terminal state is delivered the subscription releases its broker subscription; updates
 * already queued can still be read with {@link #next(Duration)}.
 */
public final class OperationSubscription implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(OperationSubscription.class);

  private final String operationId;
  private final BlockingQueue<OperationUpdate> channel = new LinkedBlockingQueue<>();
  private final List<OperationUpdate> early = new ArrayList<>();
  private final Object lock = new Object();

  private Runnable releaser;
  private Supplier<OperationUpdate> refresher;
  private boolean released;
  private boolean snapshotDelivered;
  private boolean terminalDelivered;
  private long lastSequence;
  private volatile boolean closed;

  OperationSubscription(String operationId) {
    this.operationId = operationId;
  }

  public String operationId() {
    return operationId;
  }

  /** Waits for the next update. Empty on timeout, or once the subscription is closed and drained. */
  public Optional<OperationUpdate> next(Duration timeout) throws InterruptedException {
    if (closed && channel.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(channel.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Re-reads the relay snapshot and emits it when it is newer than the last delivered update. Used
   * when the live channel has been quiet, so a terminal state the broker never delivered is still
   * seen.
   *
   * @return whether an update was emitted
   */
  public boolean refresh() {
    final Supplier<OperationUpdate> source;
    synchronized (lock) {
      if (closed || refresher == null || !snapshotDelivered) {
        return false;
      }
      source = refresher;
    }
    final OperationUpdate latest = source.get();
    synchronized (lock) {
      if (closed || latest.sequence() <= lastSequence) {
        return false;
      }
      logger.debug(
          "operation update recovered from snapshot operationId={} sequence={} lastSequence={}",
          operationId,
          latest.sequence(),
          lastSequence);
      emit(latest);
      return true;
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      closed = true;
      release();
    }
  }

  /** Runs {@code releaser} on close, or immediately when the subscription already ended. */
  void attach(Runnable releaser) {
    synchronized (lock) {
      this.releaser = releaser;
      if (closed) {
        release();
      }
    }
  }

  void attachRefresher(Supplier<OperationUpdate> refresher) {
    synchronized (lock) {
      this.refresher = refresher;
    }
  }

  void deliverSnapshot(OperationUpdate snapshot) {
    synchronized (lock) {
      if (closed) {
        return;
      }
      snapshotDelivered = true;
      emit(snapshot);
      early.sort(Comparator.comparingLong(OperationUpdate::sequence));
      for (OperationUpdate update : early) {
        emitIfNewer(update);
      }
      early.clear();
    }
  }

  void onEvent(OperationUpdate update) {
    synchronized (lock) {
      if (closed) {
        return;
      }
      if (!snapshotDelivered) {
        early.add(update);
        return;
      }
      emitIfNewer(update);
    }
  }

  private void emitIfNewer(OperationUpdate update) {
    if (terminalDelivered || update.sequence() <= lastSequence) {
      logger.debug(
          "operation update skipped operationId={} sequence={} lastSequence={}",
          operationId,
          update.sequence(),
          lastSequence);
      return;
    }
    emit(update);
  }

  private void emit(OperationUpdate update) {
    lastSequence = update.sequence();
    channel.add(update);
    if (update.isTerminal()) {
      terminalDelivered = true;
      closed = true;
      release();
    }
  }

  private void release() {
    if (released || releaser == null) {
      return;
    }
    released = true;
    releaser.run();
  }
}
