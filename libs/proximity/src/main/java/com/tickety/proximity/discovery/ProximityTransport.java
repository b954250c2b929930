/*
 * Where: proximity discovery
 * What: the short-range radio binding a device provides
 * Why: the handshake only needs send, receive and availability, not a specific radio stack
 */
package com.tickety.proximity.discovery;

import java.time.Duration;

public interface ProximityTransport {

  /** False when the hardware is absent or disabled; callers fall back to QR or email. */
  boolean isAvailable();

  /** Starts advertising one frame until {@link #stopBroadcast()} or another broadcast. */
  void broadcast(byte[] frame);

  void stopBroadcast();

  /**
   * Blocks until a nearby broadcaster is read or the timeout elapses.
   *
   * @return the raw frame, or {@code null} when nothing was read in time
   */
  byte[] receive(Duration timeout) throws InterruptedException;
}
