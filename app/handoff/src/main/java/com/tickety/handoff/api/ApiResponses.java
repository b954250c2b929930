/*
 * Where: handoff API
 * What: helpers turning typed service outcomes into HTTP responses
 * Why: every controller reports failures in the same error body
 */
package com.tickety.handoff.api;

import com.tickety.handoff.service.CommandResponse;
import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class ApiResponses {

  private ApiResponses() {}

  static CommandResponse error(HttpStatus status, ApiErrorCode code, String message) {
    return CommandResponse.of(status.value(), new ApiErrorResponse(code, message));
  }

  static ResponseEntity<Object> toEntity(CommandResponse response) {
    return ResponseEntity.status(response.status()).body(response.body());
  }

  static ResponseEntity<Object> errorEntity(HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  /** Null keeps the configured default TTL. */
  static Duration ttl(Long ttlSeconds) {
    return ttlSeconds == null ? null : Duration.ofSeconds(ttlSeconds);
  }
}
