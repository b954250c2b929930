package com.tickety.handoff.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.junit.jupiter.api.Test;

class IdempotencyLockKeyGeneratorTest {

  private final IdempotencyLockKeyGenerator generator = new IdempotencyLockKeyGenerator();

  @Test
  void keyIsFirstEightBytesOfSha256() throws Exception {
    final byte[] digest =
        MessageDigest.getInstance("SHA-256").digest("idem-1".getBytes(StandardCharsets.UTF_8));
    final long expected = ByteBuffer.wrap(digest, 0, IdempotencyLockKeyGenerator.LOCK_KEY_BYTES).getLong();

    assertThat(generator.generate("idem-1")).isEqualTo(expected);
  }

  @Test
  void distinctKeysGiveDistinctLocks() {
    assertThat(generator.generate("idem-1")).isNotEqualTo(generator.generate("idem-2"));
    assertThat(generator.generate("idem-1")).isEqualTo(generator.generate("idem-1"));
  }
}
