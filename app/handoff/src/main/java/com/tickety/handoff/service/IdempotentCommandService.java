/*
 * Where: handoff service layer
 * What: runs a mutating command at most once per Idempotency-Key and stores its response
 * Why: devices on flaky networks retry creates and handoffs, and the retry must not act twice
 */
package com.tickety.handoff.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickety.handoff.api.IdempotencyConflictException;
import com.tickety.handoff.config.HandoffIdempotencyProperties;
import com.tickety.handoff.model.IdempotencyRecord;
import com.tickety.handoff.repository.IdempotencyKeyRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Idempotency-Key handling shared by every mutating endpoint.
 *
 * <p>The key is serialised with a transaction-scoped advisory lock, then looked up again under the
 * lock. A live record with the same request hash is replayed as stored; a different hash is a
 * conflict. Error responses are stored as well, so a retry observes the same rejection.
 */
@Service
@RequiredArgsConstructor
public class IdempotentCommandService {

  private static final Logger logger = LoggerFactory.getLogger(IdempotentCommandService.class);

  private final IdempotencyKeyRepository idempotencyKeyRepository;
  private final IdempotencyLockKeyGenerator lockKeyGenerator;
  private final RequestHasher requestHasher;
  private final ObjectMapper objectMapper;
  private final HandoffIdempotencyProperties idempotencyProperties;
  private final Clock clock;

  @Transactional
  public CommandResponse execute(
      String idempotencyKey,
      String action,
      String actorId,
      Object request,
      Supplier<CommandResponse> command) {
    final String requestHash = requestHasher.hash(action, actorId, request);
    idempotencyKeyRepository.lockByKey(lockKeyGenerator.generate(idempotencyKey));
    final Instant now = Instant.now(clock);
    final Optional<IdempotencyRecord> existing =
        idempotencyKeyRepository.findLiveByKey(idempotencyKey, now);
    if (existing.isPresent()) {
      return replay(existing.get(), requestHash);
    }
    final CommandResponse response = command.get();
    store(idempotencyKey, requestHash, response, now);
    return response;
  }

  private CommandResponse replay(IdempotencyRecord record, String requestHash) {
    if (!record.requestHash().equals(requestHash)) {
      throw new IdempotencyConflictException("Idempotency-Key conflict");
    }
    try {
      final JsonNode body = objectMapper.readTree(record.responseBodyJson());
      logger.info(
          "idempotent response replayed idempotencyKey={} status={}",
          record.idempotencyKey(),
          record.responseCode());
      return new CommandResponse(record.responseCode(), body, true);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse idempotency response", ex);
    }
  }

  private void store(
      String idempotencyKey, String requestHash, CommandResponse response, Instant now) {
    try {
      final String responseJson = objectMapper.writeValueAsString(response.body());
      final Instant expiresAt = now.plus(Duration.ofHours(idempotencyProperties.ttlHours()));
      final IdempotencyRecord record =
          new IdempotencyRecord(
              idempotencyKey, requestHash, response.status(), responseJson, expiresAt);
      if (idempotencyKeyRepository.upsertIfExpired(record, now) == 0) {
        // the lookup above ran under the same lock
        throw new IllegalStateException("idempotency invariant violated");
      }
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize idempotency response", ex);
    }
  }
}
