/*
 * Where: OperationController web layer test
 * What: HTTP mapping of create, snapshot and transition outcomes
 * Why: each rejection has to reach the device as its own status code and error code
 */
package com.tickety.handoff.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tickety.handoff.model.OperationState;
import com.tickety.handoff.model.OperationTerms;
import com.tickety.handoff.model.PendingOperationRecord;
import com.tickety.handoff.service.CancelOutcome;
import com.tickety.handoff.service.CommandResponse;
import com.tickety.handoff.service.CreateOperationOutcome;
import com.tickety.handoff.service.IdempotentCommandService;
import com.tickety.handoff.service.PendingOperationRelay;
import com.tickety.handoff.service.TransitionOutcome;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(OperationController.class)
@Import(ApiExceptionHandler.class)
class OperationControllerTest {

  private static final UUID OPERATION_ID = UUID.fromString("0f6f4d7e-8a53-4c55-9d53-1f1c6f0b2f10");
  private static final Instant CREATED_AT = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PendingOperationRelay relay;
  @MockitoBean private IdempotentCommandService idempotentCommandService;

  @BeforeEach
  void runCommandsDirectly() {
    when(idempotentCommandService.execute(anyString(), anyString(), anyString(), any(), any()))
        .thenAnswer(invocation -> invocation.<Supplier<CommandResponse>>getArgument(4).get());
  }

  @Test
  void createPaymentReturns201WithSequenceOne() throws Exception {
    final PendingOperationRecord operation = payment(OperationState.PENDING, 1L);
    when(relay.createPayment("actor-m", "actor-c", "order-1", 1250L, "EUR", null))
        .thenReturn(new CreateOperationOutcome(CreateOperationOutcome.Status.CREATED, operation, null));

    mockMvc
        .perform(
            post("/v1/operations")
                .header("X-Actor-Id", "actor-m")
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind":"PAYMENT","counterparty_actor_id":"actor-c","subject_ref":"order-1",
                     "amount_cents":1250,"currency":"EUR"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.operation_id").value(OPERATION_ID.toString()))
        .andExpect(jsonPath("$.state").value("PENDING"))
        .andExpect(jsonPath("$.sequence").value(1))
        .andExpect(jsonPath("$.transfer_token").doesNotExist());
  }

  @Test
  void createTransferRejectsAmount() throws Exception {
    mockMvc
        .perform(
            post("/v1/operations")
                .header("X-Actor-Id", "actor-m")
                .header("Idempotency-Key", "idem-2")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind":"TRANSFER","subject_ref":"ticket-1","amount_cents":10}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("transfers carry no amount"));
  }

  @Test
  void createTransferForForeignTicketIs403() throws Exception {
    when(relay.createTransfer("actor-m", null, "ticket-1", null))
        .thenReturn(new CreateOperationOutcome(CreateOperationOutcome.Status.NOT_OWNER, null, null));

    mockMvc
        .perform(
            post("/v1/operations")
                .header("X-Actor-Id", "actor-m")
                .header("Idempotency-Key", "idem-3")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"TRANSFER\",\"subject_ref\":\"ticket-1\"}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_OWNER"));
  }

  @Test
  void createWithoutIdempotencyKeyIs400() throws Exception {
    mockMvc
        .perform(
            post("/v1/operations")
                .header("X-Actor-Id", "actor-m")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"TRANSFER\",\"subject_ref\":\"ticket-1\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Idempotency-Key is required"));
    verifyNoInteractions(relay);
  }

  @Test
  void snapshotMapsAccessErrors() throws Exception {
    when(relay.snapshot(OPERATION_ID, "actor-x"))
        .thenThrow(new OperationAccessDeniedException(OPERATION_ID));

    mockMvc
        .perform(get("/v1/operations/" + OPERATION_ID).header("X-Actor-Id", "actor-x"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"));
  }

  @Test
  void invalidOperationIdIs400() throws Exception {
    mockMvc
        .perform(get("/v1/operations/not-a-uuid").header("X-Actor-Id", "actor-x"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("operation_id is invalid"));
  }

  @Test
  void incomingListsOpenOperations() throws Exception {
    when(relay.listIncoming("actor-c")).thenReturn(List.of(payment(OperationState.PENDING, 1L)));

    mockMvc
        .perform(get("/v1/operations/incoming").header("X-Actor-Id", "actor-c"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.actor_id").value("actor-c"))
        .andExpect(jsonPath("$.items[0].amount_cents").value(1250));
  }

  @Test
  void acknowledgeReturnsNewState() throws Exception {
    when(relay.acknowledge(OPERATION_ID, "actor-c"))
        .thenReturn(
            new TransitionOutcome(
                TransitionOutcome.Status.APPLIED, payment(OperationState.PROCESSING, 2L)));

    mockMvc
        .perform(post("/v1/operations/" + OPERATION_ID + "/acknowledge").header("X-Actor-Id", "actor-c"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("PROCESSING"))
        .andExpect(jsonPath("$.sequence").value(2));
  }

  @Test
  void transitionOutcomesMapToStatusCodes() throws Exception {
    when(relay.complete(OPERATION_ID, "actor-c", "charge-1"))
        .thenReturn(
            new TransitionOutcome(
                TransitionOutcome.Status.EXPIRED, payment(OperationState.EXPIRED, 2L)));
    when(relay.fail(eq(OPERATION_ID), eq("actor-c"), isNull()))
        .thenReturn(
            new TransitionOutcome(
                TransitionOutcome.Status.ILLEGAL_TRANSITION, payment(OperationState.COMPLETED, 3L)));

    mockMvc
        .perform(
            post("/v1/operations/" + OPERATION_ID + "/complete")
                .header("X-Actor-Id", "actor-c")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"charge_ref\":\"charge-1\"}"))
        .andExpect(status().isGone())
        .andExpect(jsonPath("$.code").value("OPERATION_EXPIRED"));
    mockMvc
        .perform(post("/v1/operations/" + OPERATION_ID + "/fail").header("X-Actor-Id", "actor-c"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ILLEGAL_TRANSITION"));
  }

  @Test
  void cancelByCounterpartyIs403AndTerminalIs409() throws Exception {
    when(relay.cancel(OPERATION_ID, "actor-c"))
        .thenReturn(new CancelOutcome(CancelOutcome.Status.NOT_AUTHORIZED, payment(OperationState.PENDING, 1L)));
    when(relay.cancel(OPERATION_ID, "actor-m"))
        .thenReturn(
            new CancelOutcome(
                CancelOutcome.Status.ALREADY_TERMINAL, payment(OperationState.COMPLETED, 3L)));

    mockMvc
        .perform(post("/v1/operations/" + OPERATION_ID + "/cancel").header("X-Actor-Id", "actor-c"))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(post("/v1/operations/" + OPERATION_ID + "/cancel").header("X-Actor-Id", "actor-m"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALREADY_TERMINAL"));
  }

  private static PendingOperationRecord payment(OperationState state, long version) {
    return new PendingOperationRecord(
        OPERATION_ID,
        new OperationTerms.Payment(1250L, "EUR"),
        "actor-m",
        "actor-c",
        "order-1",
        state,
        null,
        null,
        CREATED_AT,
        CREATED_AT,
        CREATED_AT.plusSeconds(300),
        version);
  }
}
