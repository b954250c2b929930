/*
 * Where: IdempotentCommandService integration test
 * What: replay, conflict and expiry of Idempotency-Key records
 * Why: a retried create must not create a second operation
 */
package com.tickety.handoff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.tickety.handoff.AbstractPostgresContainerTest;
import com.tickety.handoff.HandoffTestData;
import com.tickety.handoff.MutableClock;
import com.tickety.handoff.MutableClockConfig;
import com.tickety.handoff.api.IdempotencyConflictException;
import com.tickety.handoff.repository.IdempotencyKeyRepository;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
@Import(MutableClockConfig.class)
class IdempotentCommandServiceTest extends AbstractPostgresContainerTest {

  private static final String ACTION = "CREATE_OPERATION";
  private static final String ACTOR = "actor-1";

  @Autowired private IdempotentCommandService idempotentCommandService;
  @Autowired private IdempotencyKeyRepository idempotencyKeyRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private MutableClock clock;

  @BeforeEach
  void setUp() {
    HandoffTestData.truncate(jdbcTemplate);
    clock.set(MutableClockConfig.START);
  }

  @Test
  void sameKeyAndRequestReplaysStoredResponse() {
    final AtomicInteger calls = new AtomicInteger();
    final Map<String, String> request = Map.of("subject_ref", "order-1");

    final CommandResponse first =
        idempotentCommandService.execute(
            "idem-1", ACTION, ACTOR, request, () -> created(calls.incrementAndGet()));
    final CommandResponse second =
        idempotentCommandService.execute(
            "idem-1", ACTION, ACTOR, request, () -> created(calls.incrementAndGet()));

    assertThat(calls).hasValue(1);
    assertThat(first.replayed()).isFalse();
    assertThat(second.replayed()).isTrue();
    assertThat(second.status()).isEqualTo(201);
    assertThat(((JsonNode) second.body()).get("attempt").asInt()).isEqualTo(1);
  }

  @Test
  void sameKeyWithDifferentRequestIsConflict() {
    idempotentCommandService.execute(
        "idem-2", ACTION, ACTOR, Map.of("subject_ref", "order-1"), () -> created(1));

    assertThatThrownBy(
            () ->
                idempotentCommandService.execute(
                    "idem-2", ACTION, ACTOR, Map.of("subject_ref", "order-2"), () -> created(2)))
        .isInstanceOf(IdempotencyConflictException.class);
    assertThatThrownBy(
            () ->
                idempotentCommandService.execute(
                    "idem-2", ACTION, "actor-2", Map.of("subject_ref", "order-1"), () -> created(2)))
        .isInstanceOf(IdempotencyConflictException.class);
  }

  @Test
  void expiredKeyRunsCommandAgain() {
    final AtomicInteger calls = new AtomicInteger();
    final Map<String, String> request = Map.of("subject_ref", "order-1");
    idempotentCommandService.execute(
        "idem-3", ACTION, ACTOR, request, () -> created(calls.incrementAndGet()));

    clock.advance(Duration.ofHours(25));
    final CommandResponse again =
        idempotentCommandService.execute(
            "idem-3", ACTION, ACTOR, request, () -> created(calls.incrementAndGet()));

    assertThat(calls).hasValue(2);
    assertThat(again.replayed()).isFalse();
    assertThat(idempotencyKeyRepository.deleteExpired(clock.instant())).isZero();
  }

  private static CommandResponse created(int attempt) {
    return CommandResponse.of(201, Map.of("attempt", attempt));
  }
}
