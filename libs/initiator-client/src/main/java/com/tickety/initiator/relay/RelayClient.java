/*
 * Where: initiator client relay calls
 * What: REST client for the handoff relay used by vendor, staff and customer devices
 * Why: reads are retried with backoff and creates reuse one Idempotency-Key across retries
 */
package com.tickety.initiator.relay;

import com.google.common.annotations.VisibleForTesting;
import com.tickety.initiator.config.RelayClientProperties;
import com.tickety.initiator.relay.dto.CancelResult;
import com.tickety.initiator.relay.dto.ClaimCommand;
import com.tickety.initiator.relay.dto.ClaimOutcome;
import com.tickety.initiator.relay.dto.CompleteCommand;
import com.tickety.initiator.relay.dto.CreateOperationCommand;
import com.tickety.initiator.relay.dto.FailCommand;
import com.tickety.initiator.relay.dto.IncomingOperations;
import com.tickety.initiator.relay.dto.OperationSnapshot;
import com.tickety.initiator.relay.dto.RelayErrorBody;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Device-side access to the relay.
 *
 * <p>Only {@link #snapshot}, {@link #listIncoming} and {@link #create} are retried. Cancel, claim
 * and the counterparty transitions carry no idempotency key, so a timeout is reported to the caller,
 * who re-reads the snapshot before trying again.
 */
public class RelayClient {

  private static final Logger logger = LoggerFactory.getLogger(RelayClient.class);

  static final String OPERATIONS_PATH = "/v1/operations";
  static final String OPERATION_PATH = "/v1/operations/{operationId}";
  static final String INCOMING_PATH = "/v1/operations/incoming";
  static final String ACTION_PATH = "/v1/operations/{operationId}/{action}";
  static final String CLAIMS_PATH = "/v1/claims";

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring component and cannot be copied")
  private final RestClient relayRestClient;

  private final RelayClientProperties properties;
  private final RetryBackoff backoff;
  private final Sleeper sleeper;

  public RelayClient(
      RestClient relayRestClient, RelayClientProperties properties, RetryBackoff backoff) {
    this(relayRestClient, properties, backoff, duration -> Thread.sleep(duration.toMillis()));
  }

  @VisibleForTesting
  RelayClient(
      RestClient relayRestClient,
      RelayClientProperties properties,
      RetryBackoff backoff,
      Sleeper sleeper) {
    this.relayRestClient = relayRestClient;
    this.properties = properties;
    this.backoff = backoff;
    this.sleeper = sleeper;
  }

  public OperationSnapshot createPayment(
      String initiatorActorId,
      String counterpartyActorId,
      String orderRef,
      long amountCents,
      String currency,
      Duration ttl) {
    return create(
        initiatorActorId,
        UUID.randomUUID().toString(),
        CreateOperationCommand.payment(counterpartyActorId, orderRef, amountCents, currency, ttl));
  }

  public OperationSnapshot createTransfer(
      String initiatorActorId, String counterpartyActorId, String ticketId, Duration ttl) {
    return create(
        initiatorActorId,
        UUID.randomUUID().toString(),
        CreateOperationCommand.transfer(counterpartyActorId, ticketId, ttl));
  }

  /** Every retry sends the same {@code idempotencyKey}, so the relay creates at most one row. */
  public OperationSnapshot create(
      String initiatorActorId, String idempotencyKey, CreateOperationCommand command) {
    validateActorId(initiatorActorId);
    if (isBlank(idempotencyKey)) {
      throw new IllegalArgumentException("idempotencyKey is required");
    }
    return withRetry(
        "create",
        () ->
            requireSnapshot(
                relayRestClient
                    .post()
                    .uri(OPERATIONS_PATH)
                    .header(properties.actorIdHeaderName(), initiatorActorId)
                    .header(properties.idempotencyKeyHeaderName(), idempotencyKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(command)
                    .retrieve()
                    .body(OperationSnapshot.class)));
  }

  public OperationSnapshot snapshot(String operationId, String actorId) {
    validateOperationId(operationId);
    validateActorId(actorId);
    return withRetry(
        "snapshot",
        () ->
            requireSnapshot(
                relayRestClient
                    .get()
                    .uri(OPERATION_PATH, operationId)
                    .header(properties.actorIdHeaderName(), actorId)
                    .retrieve()
                    .body(OperationSnapshot.class)));
  }

  public IncomingOperations listIncoming(String actorId) {
    validateActorId(actorId);
    return withRetry(
        "listIncoming",
        () -> {
          final IncomingOperations response =
              relayRestClient
                  .get()
                  .uri(INCOMING_PATH)
                  .header(properties.actorIdHeaderName(), actorId)
                  .retrieve()
                  .body(IncomingOperations.class);
          if (response == null) {
            throw invalidResponse();
          }
          return response;
        });
  }

  public OperationSnapshot acknowledge(String operationId, String counterpartyActorId) {
    return transition(operationId, counterpartyActorId, "acknowledge", null);
  }

  public OperationSnapshot complete(
      String operationId, String counterpartyActorId, String chargeRef) {
    if (isBlank(chargeRef)) {
      throw new IllegalArgumentException("chargeRef is required");
    }
    return transition(operationId, counterpartyActorId, "complete", new CompleteCommand(chargeRef));
  }

  public OperationSnapshot fail(String operationId, String counterpartyActorId, String reason) {
    return transition(operationId, counterpartyActorId, "fail", new FailCommand(reason));
  }

  public CancelResult cancel(String operationId, String initiatorActorId) {
    validateOperationId(operationId);
    validateActorId(initiatorActorId);
    try {
      final OperationSnapshot cancelled =
          call(
              "cancel",
              () ->
                  requireSnapshot(
                      relayRestClient
                          .post()
                          .uri(ACTION_PATH, operationId, "cancel")
                          .header(properties.actorIdHeaderName(), initiatorActorId)
                          .retrieve()
                          .body(OperationSnapshot.class)));
      return new CancelResult(CancelResult.Status.CANCELLED, cancelled);
    } catch (RelayIntegrationException ex) {
      return switch (ex.reason()) {
        case FORBIDDEN -> new CancelResult(CancelResult.Status.NOT_AUTHORIZED, null);
        case NOT_FOUND -> new CancelResult(CancelResult.Status.NOT_FOUND, null);
        case CONFLICT ->
            new CancelResult(
                CancelResult.Status.ALREADY_TERMINAL, terminalSnapshot(operationId, initiatorActorId));
        default -> throw ex;
      };
    }
  }

  /** The state that beat the cancel; null when it cannot be read right now. */
  private OperationSnapshot terminalSnapshot(String operationId, String actorId) {
    try {
      return snapshot(operationId, actorId);
    } catch (RelayIntegrationException ex) {
      logger.warn(
          "relay snapshot after rejected cancel failed operationId={} reason={}",
          operationId,
          ex.reason(),
          ex);
      return null;
    }
  }

  /** Rejections come back as a {@link ClaimOutcome} with an error; only transport faults throw. */
  public ClaimOutcome claim(String transferToken, String claimantActorId) {
    if (isBlank(transferToken)) {
      throw new IllegalArgumentException("transferToken is required");
    }
    validateActorId(claimantActorId);
    final ClaimOutcome outcome =
        call(
            "claim",
            () ->
                requireClaim(
                    relayRestClient
                        .post()
                        .uri(CLAIMS_PATH)
                        .header(properties.actorIdHeaderName(), claimantActorId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(new ClaimCommand(transferToken))
                        .exchange(
                            (request, response) -> {
                              final HttpStatusCode status = response.getStatusCode();
                              if (status.is5xxServerError()) {
                                throw new RelayIntegrationException(
                                    RelayIntegrationException.Reason.BAD_GATEWAY,
                                    "relay server error");
                              }
                              if (status.value() == 400) {
                                throw new RelayIntegrationException(
                                    RelayIntegrationException.Reason.BAD_REQUEST,
                                    "relay rejected the claim request");
                              }
                              return response.bodyTo(ClaimOutcome.class);
                            })));
    if (!outcome.isClaimed()) {
      logger.info(
          "relay claim rejected tokenId={} error={}", shorten(transferToken), outcome.error());
    }
    return outcome;
  }

  private OperationSnapshot transition(
      String operationId, String actorId, String action, Object body) {
    validateOperationId(operationId);
    validateActorId(actorId);
    return call(
        action,
        () -> {
          final RestClient.RequestBodySpec spec =
              relayRestClient
                  .post()
                  .uri(ACTION_PATH, operationId, action)
                  .header(properties.actorIdHeaderName(), actorId);
          if (body != null) {
            spec.contentType(MediaType.APPLICATION_JSON).body(body);
          }
          return requireSnapshot(spec.retrieve().body(OperationSnapshot.class));
        });
  }

  private <T> T withRetry(String operation, Supplier<T> request) {
    int attempt = 1;
    while (true) {
      try {
        return call(operation, request);
      } catch (RelayIntegrationException ex) {
        if (!ex.isRetryable() || attempt >= properties.maxAttempts()) {
          throw ex;
        }
        final Duration delay = backoff.delay(attempt);
        logger.info(
            "relay {} retry scheduled reason={} attempt={} delayMs={}",
            operation,
            ex.reason(),
            attempt,
            delay.toMillis());
        pause(delay, ex);
        attempt++;
      }
    }
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (RelayIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("relay {} response parse failed", operation, ex);
      throw new RelayIntegrationException(
          RelayIntegrationException.Reason.INVALID_RESPONSE, "relay response parse failed", ex);
    }
  }

  private void pause(Duration delay, RelayIntegrationException cause) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RelayIntegrationException(
          RelayIntegrationException.Reason.TIMEOUT, "relay retry interrupted", cause);
    }
  }

  private OperationSnapshot requireSnapshot(OperationSnapshot snapshot) {
    if (snapshot == null || isBlank(snapshot.operationId()) || isBlank(snapshot.state())) {
      throw invalidResponse();
    }
    return snapshot;
  }

  private ClaimOutcome requireClaim(ClaimOutcome outcome) {
    if (outcome == null || (outcome.error() == null && outcome.ticket() == null)) {
      throw invalidResponse();
    }
    return outcome;
  }

  private RelayIntegrationException invalidResponse() {
    return new RelayIntegrationException(
        RelayIntegrationException.Reason.INVALID_RESPONSE, "relay response is invalid");
  }

  private RelayIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    final String errorCode = errorCode(ex);
    logger.warn(
        "relay {} failed with http status={} code={}", operation, status, errorCode);
    final RelayIntegrationException.Reason reason =
        switch (status) {
          case 400 -> RelayIntegrationException.Reason.BAD_REQUEST;
          case 403 -> RelayIntegrationException.Reason.FORBIDDEN;
          case 404 -> RelayIntegrationException.Reason.NOT_FOUND;
          case 409 -> RelayIntegrationException.Reason.CONFLICT;
          case 410 -> RelayIntegrationException.Reason.GONE;
          default -> RelayIntegrationException.Reason.BAD_GATEWAY;
        };
    return new RelayIntegrationException(
        reason, errorCode, "relay " + operation + " failed with status " + status, ex);
  }

  private String errorCode(RestClientResponseException ex) {
    if (ex.getStatusCode().is5xxServerError()) {
      return null;
    }
    try {
      final RelayErrorBody body = ex.getResponseBodyAs(RelayErrorBody.class);
      return body == null ? null : body.code();
    } catch (RuntimeException parseFailure) {
      logger.debug("relay error body is not readable status={}", ex.getStatusCode().value());
      return null;
    }
  }

  private RelayIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("relay {} timed out", operation);
      return new RelayIntegrationException(
          RelayIntegrationException.Reason.TIMEOUT, "relay request timeout", ex);
    }
    logger.warn("relay {} connection failed", operation, ex);
    return new RelayIntegrationException(
        RelayIntegrationException.Reason.BAD_GATEWAY, "relay connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void validateOperationId(String operationId) {
    if (isBlank(operationId)) {
      throw new IllegalArgumentException("operationId is required");
    }
  }

  private void validateActorId(String actorId) {
    if (isBlank(actorId)) {
      throw new IllegalArgumentException("actorId is required");
    }
  }

  private static String shorten(String tokenId) {
    return tokenId.length() <= 8 ? tokenId : tokenId.substring(0, 8);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
