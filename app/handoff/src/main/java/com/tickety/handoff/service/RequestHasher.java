/*
 * Where: handoff service helper
 * What: hashes a mutating request for Idempotency-Key comparison
 * Why: the same key sent with a different request must be rejected
 */
package com.tickety.handoff.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RequestHasher {

  private final ObjectMapper objectMapper;

  public String hash(String action, String actorId, Object request) {
    final Map<String, Object> canonical = new LinkedHashMap<>();
    // fixed key order so equal input always serialises to equal JSON
    canonical.put("action", action);
    canonical.put("actor_id", actorId);
    canonical.put("request", request);
    try {
      final String json = objectMapper.writeValueAsString(canonical);
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      final byte[] hashed = digest.digest(json.getBytes(StandardCharsets.UTF_8));
      return toHex(hashed);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize request for idempotency", ex);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
