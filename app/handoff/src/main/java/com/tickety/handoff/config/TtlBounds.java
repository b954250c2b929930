package com.tickety.handoff.config;

import java.time.Duration;

final class TtlBounds {

  private TtlBounds() {}

  static Duration clamp(Duration requested, Duration fallback, Duration min, Duration max) {
    if (requested == null) {
      return fallback;
    }
    if (requested.compareTo(min) < 0) {
      return min;
    }
    if (requested.compareTo(max) > 0) {
      return max;
    }
    return requested;
  }
}
