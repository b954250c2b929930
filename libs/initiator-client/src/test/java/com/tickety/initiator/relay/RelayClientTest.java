package com.tickety.initiator.relay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.tickety.initiator.config.RelayClientProperties;
import com.tickety.initiator.relay.dto.CancelResult;
import com.tickety.initiator.relay.dto.ClaimOutcome;
import com.tickety.initiator.relay.dto.CreateOperationCommand;
import com.tickety.initiator.relay.dto.OperationSnapshot;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class RelayClientTest {

  private static final String OPERATION_URL = "http://relay.test/v1/operations/op-1";

  private static final String PENDING_PAYMENT =
      """
      {"operation_id":"op-1","kind":"PAYMENT","state":"PENDING","initiator_actor_id":"actor-m",
       "counterparty_actor_id":"actor-c","subject_ref":"order-1","amount_cents":1250,
       "currency":"EUR","created_at":"2026-03-01T10:00:00Z","updated_at":"2026-03-01T10:00:00Z",
       "expires_at":"2026-03-01T10:05:00Z","sequence":1}
      """;

  @Test
  void snapshotSendsActorHeader() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(OPERATION_URL))
        .andExpect(method(GET))
        .andExpect(header("X-Actor-Id", "actor-m"))
        .andRespond(withSuccess(PENDING_PAYMENT, MediaType.APPLICATION_JSON));

    final OperationSnapshot snapshot = fixture.client.snapshot("op-1", "actor-m");

    assertThat(snapshot.state()).isEqualTo("PENDING");
    assertThat(snapshot.sequence()).isEqualTo(1L);
    assertThat(snapshot.amountCents()).isEqualTo(1250L);
    assertThat(snapshot.expiresAt()).isEqualTo(Instant.parse("2026-03-01T10:05:00Z"));
    fixture.server.verify();
  }

  @Test
  void snapshotRetriesServerErrorWithBackoff() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(OPERATION_URL)).andRespond(withServerError());
    fixture
        .server
        .expect(requestTo(OPERATION_URL))
        .andRespond(withSuccess(PENDING_PAYMENT, MediaType.APPLICATION_JSON));

    final OperationSnapshot snapshot = fixture.client.snapshot("op-1", "actor-m");

    assertThat(snapshot.operationId()).isEqualTo("op-1");
    assertThat(fixture.sleeps).hasSize(1);
    assertThat(fixture.sleeps.get(0)).isBetween(Duration.ofMillis(5), Duration.ofMillis(10));
    fixture.server.verify();
  }

  @Test
  void snapshotGivesUpAfterMaxAttempts() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(times(3), requestTo(OPERATION_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.snapshot("op-1", "actor-m"))
        .isInstanceOf(RelayIntegrationException.class)
        .extracting(ex -> ((RelayIntegrationException) ex).reason())
        .isEqualTo(RelayIntegrationException.Reason.TIMEOUT);
    assertThat(fixture.sleeps).hasSize(2);
    fixture.server.verify();
  }

  @Test
  void snapshotDoesNotRetryNotFound() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(OPERATION_URL))
        .andRespond(
            withStatus(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"code\":\"OPERATION_NOT_FOUND\",\"message\":\"operation not found\"}"));

    assertThatThrownBy(() -> fixture.client.snapshot("op-1", "actor-m"))
        .isInstanceOf(RelayIntegrationException.class)
        .satisfies(
            ex -> {
              final RelayIntegrationException relayException = (RelayIntegrationException) ex;
              assertThat(relayException.reason())
                  .isEqualTo(RelayIntegrationException.Reason.NOT_FOUND);
              assertThat(relayException.errorCode()).isEqualTo("OPERATION_NOT_FOUND");
            });
    assertThat(fixture.sleeps).isEmpty();
  }

  @Test
  void snapshotWithoutStateIsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(OPERATION_URL))
        .andRespond(withSuccess("{\"operation_id\":\"op-1\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.snapshot("op-1", "actor-m"))
        .isInstanceOf(RelayIntegrationException.class)
        .extracting(ex -> ((RelayIntegrationException) ex).reason())
        .isEqualTo(RelayIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void createRetriesWithTheSameIdempotencyKey() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/operations"))
        .andExpect(method(POST))
        .andExpect(header("Idempotency-Key", "idem-1"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/operations"))
        .andExpect(header("Idempotency-Key", "idem-1"))
        .andExpect(jsonPath("$.kind").value("TRANSFER"))
        .andExpect(jsonPath("$.subject_ref").value("ticket-1"))
        .andExpect(jsonPath("$.amount_cents").doesNotExist())
        .andRespond(
            withStatus(HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    """
                    {"operation_id":"op-2","kind":"TRANSFER","state":"PENDING",
                     "initiator_actor_id":"actor-h","subject_ref":"ticket-1","sequence":1,
                     "transfer_token":"abc123"}
                    """));

    final OperationSnapshot created =
        fixture.client.create(
            "actor-h", "idem-1", CreateOperationCommand.transfer(null, "ticket-1", null));

    assertThat(created.transferToken()).isEqualTo("abc123");
    fixture.server.verify();
  }

  @Test
  void createCarriesConflictCode() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/operations"))
        .andRespond(
            withStatus(HttpStatus.CONFLICT)
                .contentType(MediaType.APPLICATION_JSON)
                .body(
                    "{\"code\":\"ALREADY_LISTED_OR_PENDING\","
                        + "\"message\":\"ticket already has a live transfer\"}"));

    assertThatThrownBy(
            () ->
                fixture.client.createTransfer(
                    "actor-h", null, "ticket-1", Duration.ofMinutes(2)))
        .isInstanceOf(RelayIntegrationException.class)
        .satisfies(
            ex -> {
              final RelayIntegrationException relayException = (RelayIntegrationException) ex;
              assertThat(relayException.reason())
                  .isEqualTo(RelayIntegrationException.Reason.CONFLICT);
              assertThat(relayException.errorCode()).isEqualTo("ALREADY_LISTED_OR_PENDING");
            });
  }

  @Test
  void cancelMapsConflictToAlreadyTerminal() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/operations/op-1/cancel"))
        .andExpect(method(POST))
        .andRespond(
            withStatus(HttpStatus.CONFLICT)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"code\":\"ALREADY_TERMINAL\",\"message\":\"operation is already COMPLETED\"}"));
    fixture
        .server
        .expect(requestTo(OPERATION_URL))
        .andExpect(method(GET))
        .andExpect(header("X-Actor-Id", "actor-m"))
        .andRespond(
            withSuccess(
                PENDING_PAYMENT.replace("\"PENDING\"", "\"COMPLETED\"").replace(":1}", ":3}"),
                MediaType.APPLICATION_JSON));

    final CancelResult result = fixture.client.cancel("op-1", "actor-m");

    assertThat(result.status()).isEqualTo(CancelResult.Status.ALREADY_TERMINAL);
    assertThat(result.operation().state()).isEqualTo("COMPLETED");
    assertThat(result.operation().sequence()).isEqualTo(3L);
    fixture.server.verify();
  }

  @Test
  void rejectedCancelStillReportsAlreadyTerminalWhenSnapshotIsMissing() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/operations/op-1/cancel"))
        .andRespond(withStatus(HttpStatus.CONFLICT));
    fixture
        .server
        .expect(requestTo(OPERATION_URL))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    final CancelResult result = fixture.client.cancel("op-1", "actor-m");

    assertThat(result.status()).isEqualTo(CancelResult.Status.ALREADY_TERMINAL);
    assertThat(result.operation()).isNull();
    fixture.server.verify();
  }

  @Test
  void cancelIsNotRetried() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/operations/op-1/cancel"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.cancel("op-1", "actor-m"))
        .isInstanceOf(RelayIntegrationException.class)
        .extracting(ex -> ((RelayIntegrationException) ex).reason())
        .isEqualTo(RelayIntegrationException.Reason.BAD_GATEWAY);
    assertThat(fixture.sleeps).isEmpty();
    fixture.server.verify();
  }

  @Test
  void completeSendsChargeReference() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/operations/op-1/complete"))
        .andExpect(header("X-Actor-Id", "actor-c"))
        .andExpect(jsonPath("$.charge_ref").value("charge-1"))
        .andRespond(
            withSuccess(
                PENDING_PAYMENT.replace("\"PENDING\"", "\"COMPLETED\"").replace(":1}", ":3}"),
                MediaType.APPLICATION_JSON));

    final OperationSnapshot completed = fixture.client.complete("op-1", "actor-c", "charge-1");

    assertThat(completed.state()).isEqualTo("COMPLETED");
    assertThat(completed.sequence()).isEqualTo(3L);
  }

  @Test
  void claimReturnsTicketOnSuccess() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/claims"))
        .andExpect(jsonPath("$.transfer_token").value("abc123"))
        .andRespond(
            withSuccess(
                """
                {"ticket":{"ticket_id":"ticket-1","event_id":"event-1","ticket_number":"A-1",
                 "owner_actor_id":"actor-r"},"operation_id":"op-2","replayed":false}
                """,
                MediaType.APPLICATION_JSON));

    final ClaimOutcome outcome = fixture.client.claim("abc123", "actor-r");

    assertThat(outcome.isClaimed()).isTrue();
    assertThat(outcome.ticket().ownerActorId()).isEqualTo("actor-r");
  }

  @Test
  void claimReturnsRejectionInsteadOfThrowing() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://relay.test/v1/claims"))
        .andRespond(
            withStatus(HttpStatus.GONE)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"expired\",\"replayed\":false}"));

    final ClaimOutcome outcome = fixture.client.claim("abc123", "actor-r");

    assertThat(outcome.isClaimed()).isFalse();
    assertThat(outcome.error()).isEqualTo("expired");
  }

  @Test
  void claimMapsServerErrorToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo("http://relay.test/v1/claims")).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.claim("abc123", "actor-r"))
        .isInstanceOf(RelayIntegrationException.class)
        .extracting(ex -> ((RelayIntegrationException) ex).reason())
        .isEqualTo(RelayIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void rejectsBlankActorId() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.snapshot("op-1", " "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("actorId is required");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://relay.test").build();
    final RelayClientProperties properties =
        new RelayClientProperties(
            "http://relay.test",
            null,
            null,
            3,
            Duration.ofMillis(10),
            Duration.ofMillis(40),
            0.5,
            1.0);
    final List<Duration> sleeps = new ArrayList<>();
    final RelayClient client =
        new RelayClient(restClient, properties, RetryBackoff.from(properties), sleeps::add);
    return new ClientFixture(client, server, sleeps);
  }

  private record ClientFixture(
      RelayClient client, MockRestServiceServer server, List<Duration> sleeps) {}
}
