/*
 * Where: proximity discovery
 * What: advertises this device's identity or claim payload to nearby readers
 * Why: the customer device (identity) and the holder device (claim) are the broadcasting side
 */
package com.tickety.proximity.discovery;

import com.tickety.proximity.ProximityFormat;
import com.tickety.proximity.ProximityPayload;
import com.tickety.proximity.ProximityPayloadCodec;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.atomic.AtomicBoolean;

public class ProximityBroadcaster {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "the transport wraps a device radio and cannot be copied")
  private final ProximityTransport transport;

  private final ProximityPayloadCodec codec;
  private final AtomicBoolean broadcasting = new AtomicBoolean(false);

  public ProximityBroadcaster(ProximityTransport transport, ProximityPayloadCodec codec) {
    this.transport = transport;
    this.codec = codec;
  }

  /** Returns false when the transport is unavailable. */
  public boolean start(ProximityPayload payload, ProximityFormat format) {
    if (!transport.isAvailable()) {
      return false;
    }
    transport.broadcast(codec.encode(payload, format));
    broadcasting.set(true);
    return true;
  }

  public void stop() {
    if (broadcasting.compareAndSet(true, false)) {
      transport.stopBroadcast();
    }
  }

  public boolean isBroadcasting() {
    return broadcasting.get();
  }
}
