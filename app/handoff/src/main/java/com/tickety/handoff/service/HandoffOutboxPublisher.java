/*
 * Where: handoff outbox publish service
 * What: claims outbox_events rows and publishes them to their subjects
 * Why: events leave only after their transaction committed, in sequence order per operation
 */
package com.tickety.handoff.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickety.common.event.OperationStates;
import com.tickety.handoff.config.HandoffOutboxProperties;
import com.tickety.handoff.model.OutboxEventRecord;
import com.tickety.handoff.model.OutboxStatus;
import com.tickety.handoff.nats.HandoffEventTransport;
import com.tickety.handoff.repository.OutboxEventRepository;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "handoff.outbox.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class HandoffOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(HandoffOutboxPublisher.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  static final String HEADER_EVENT_TYPE = "event_type";
  static final String HEADER_AGGREGATE_KEY = "aggregate_key";
  static final String HEADER_SEQUENCE = "sequence";
  static final String HEADER_TRACE_ID = "trace_id";

  private final HandoffEventTransport transport;
  private final OutboxEventRepository outboxEventRepository;
  private final HandoffOutboxProperties properties;
  private final ObjectMapper objectMapper;
  private final HandoffMetrics metrics;
  private final Clock clock;

  public void publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final Instant leaseUntil = now.plus(properties.lease());
    final List<OutboxEventRecord> pending =
        outboxEventRepository.claimPending(properties.batchSize(), now, leaseUntil, lockedBy);
    for (OutboxEventRecord record : pending) {
      JsonNode payload = null;
      try {
        metrics.recordOutboxBacklogAge(record.createdAt(), now);
        payload = parsePayload(record);
        final Headers headers = buildHeaders(record, payload);
        transport.publish(
            record.subject(), headers, record.payloadJson().getBytes(StandardCharsets.UTF_8));
        final Instant publishedAt = Instant.now(clock);
        final int updated =
            outboxEventRepository.markPublished(record.eventId(), lockedBy, publishedAt);
        if (updated == 0) {
          logger.warn("outbox publish succeeded but lock was lost eventId={}", record.eventId());
        } else {
          metrics.recordOutboxPublishDelay(record.createdAt(), publishedAt);
        }
      } catch (JetStreamApiException | IOException ex) {
        handleFailure(record, payload, ex, now, lockedBy);
      } catch (DataAccessException ex) {
        handleFailure(record, payload, ex, now, lockedBy);
      } catch (RuntimeException ex) {
        handleFailure(record, payload, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxFailedCurrent(outboxEventRepository.countFailed());
  }

  private JsonNode parsePayload(OutboxEventRecord record) {
    try {
      return objectMapper.readTree(record.payloadJson());
    } catch (JsonProcessingException ex) {
      // retrying cannot fix an unparsable payload
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private Headers buildHeaders(OutboxEventRecord record, JsonNode payload) {
    final Headers headers = new Headers();
    headers.add(HEADER_MESSAGE_ID, record.eventId().toString());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_AGGREGATE_KEY, record.aggregateKey());
    headers.add(HEADER_SEQUENCE, Long.toString(record.sequence()));
    final JsonNode traceId = payload.get("trace_id");
    if (traceId != null && traceId.isTextual()) {
      headers.add(HEADER_TRACE_ID, traceId.asText());
    }
    return headers;
  }

  /**
   * An event carrying a terminal operation state is never moved to FAILED: it stays PENDING at the
   * capped backoff until the broker accepts it.
   */
  private void handleFailure(
      OutboxEventRecord record, JsonNode payload, Exception ex, Instant now, String lockedBy) {
    final boolean nonRetryable = ex instanceof OutboxPayloadParseException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean exhausted = nextAttempt >= properties.maxAttempts();
    final boolean failed = nonRetryable || (exhausted && !carriesTerminalState(payload));
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        outboxEventRepository.markFailure(
            record.eventId(),
            lockedBy,
            nextAttempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "outbox retry skipped because lock was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (failed) {
      if (nonRetryable) {
        logger.error(
            "outbox payload parse failed and moved to FAILED eventId={}", record.eventId(), ex);
      } else {
        logger.warn("outbox publish moved to FAILED eventId={}", record.eventId(), ex);
      }
    } else if (exhausted) {
      logger.error(
          "outbox terminal state still unpublished; retrying eventId={} attempt={}",
          record.eventId(),
          nextAttempt,
          ex);
    } else {
      logger.warn(
          "outbox publish retry scheduled eventId={} attempt={}",
          record.eventId(),
          nextAttempt,
          ex);
    }
  }

  private static boolean carriesTerminalState(JsonNode payload) {
    if (payload == null) {
      return false;
    }
    final JsonNode state = payload.get("state");
    return state != null && state.isTextual() && OperationStates.isTerminal(state.asText());
  }

  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
