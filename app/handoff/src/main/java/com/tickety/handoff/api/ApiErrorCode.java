/*
 * Where: handoff API
 * What: machine-readable error codes of the REST surface
 * Why: several outcomes share an HTTP status and clients must still tell them apart
 */
package com.tickety.handoff.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  IDEMPOTENCY_KEY_CONFLICT,
  TICKET_NOT_FOUND,
  NOT_OWNER,
  ALREADY_LISTED_OR_PENDING,
  SELF_TRANSFER,
  OPERATION_NOT_FOUND,
  NOT_AUTHORIZED,
  ILLEGAL_TRANSITION,
  OPERATION_EXPIRED,
  ALREADY_TERMINAL,
  INVALID_OPERATION_KIND
}
