/*
 * Where: handoff service helper
 * What: derives a 64-bit advisory lock key from an Idempotency-Key
 * Why: hashtext only yields 32 bits and would serialise unrelated keys together
 */
package com.tickety.handoff.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class IdempotencyLockKeyGenerator {

  // first 8 bytes of SHA-256
  static final int LOCK_KEY_BYTES = 8;

  public long generate(String idempotencyKey) {
    final byte[] hashed = hash(idempotencyKey);
    // big endian, ByteBuffer's default
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String idempotencyKey) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(idempotencyKey.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
