/*
 * Where: proximity codec
 * What: outcome of decoding one frame, either a payload or a malformed marker
 * Why: a bad frame is an expected event on a radio channel and must not be an exception
 */
package com.tickety.proximity;

import java.util.Optional;

public record DecodeResult(ProximityPayload payload, ProximityFormat format, String malformedReason) {

  public static DecodeResult decoded(ProximityPayload payload, ProximityFormat format) {
    return new DecodeResult(payload, format, null);
  }

  public static DecodeResult malformed(String reason) {
    return new DecodeResult(null, null, reason);
  }

  public boolean isMalformed() {
    return payload == null;
  }

  public Optional<ProximityPayload> asPayload() {
    return Optional.ofNullable(payload);
  }
}
