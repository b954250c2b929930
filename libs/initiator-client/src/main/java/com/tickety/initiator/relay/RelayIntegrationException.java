/*
 * Where: initiator client relay calls
 * What: a failed relay call, classified so the device can decide to retry or to show an error
 * Why: a timeout is worth retrying, a rejected request is not
 */
package com.tickety.initiator.relay;

public class RelayIntegrationException extends RuntimeException {

  public enum Reason {
    BAD_REQUEST,
    FORBIDDEN,
    NOT_FOUND,
    CONFLICT,
    GONE,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;
  private final String errorCode;

  public RelayIntegrationException(Reason reason, String message) {
    this(reason, null, message, null);
  }

  public RelayIntegrationException(Reason reason, String message, Throwable cause) {
    this(reason, null, message, cause);
  }

  public RelayIntegrationException(
      Reason reason, String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.errorCode = errorCode;
  }

  public Reason reason() {
    return reason;
  }

  /** The relay's error code (for example {@code ALREADY_TERMINAL}), when the body carried one. */
  public String errorCode() {
    return errorCode;
  }

  /** Timeouts and gateway errors may succeed on a later attempt; everything else will not. */
  public boolean isRetryable() {
    return reason == Reason.TIMEOUT || reason == Reason.BAD_GATEWAY;
  }
}
