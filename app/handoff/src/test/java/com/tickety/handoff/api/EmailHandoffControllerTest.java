/*
 * Where: EmailHandoffController web layer test
 * What: delivered and deferred handoffs, and the self-only bind endpoint
 * Why: an actor may only bind deliveries to their own account
 */
package com.tickety.handoff.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tickety.handoff.model.TicketRecord;
import com.tickety.handoff.service.CommandResponse;
import com.tickety.handoff.service.DeferredBindResult;
import com.tickety.handoff.service.EmailHandoffOutcome;
import com.tickety.handoff.service.EmailHandoffService;
import com.tickety.handoff.service.IdempotentCommandService;
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
import org.springframework.test.web.servlet.RequestBuilder;

@WebMvcTest(EmailHandoffController.class)
@Import(ApiExceptionHandler.class)
class EmailHandoffControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private EmailHandoffService emailHandoffService;
  @MockitoBean private IdempotentCommandService idempotentCommandService;

  @BeforeEach
  void runCommandsDirectly() {
    when(idempotentCommandService.execute(anyString(), anyString(), anyString(), any(), any()))
        .thenAnswer(invocation -> invocation.<Supplier<CommandResponse>>getArgument(4).get());
  }

  @Test
  void registeredRecipientIsDelivered() throws Exception {
    final TicketRecord ticket =
        new TicketRecord("ticket-1", "event-1", "A-1", "actor-r", "r@example.com", 2L, NOW);
    when(emailHandoffService.handoffByEmail("actor-h", "ticket-1", "r@example.com"))
        .thenReturn(
            new EmailHandoffOutcome(EmailHandoffOutcome.Status.DELIVERED, ticket, "actor-r", null));

    mockMvc
        .perform(handoff("r@example.com"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DELIVERED"))
        .andExpect(jsonPath("$.recipient_actor_id").value("actor-r"))
        .andExpect(jsonPath("$.ticket.owner_actor_id").value("actor-r"))
        .andExpect(jsonPath("$.delivery_id").doesNotExist());
  }

  @Test
  void unregisteredRecipientIsDeferred() throws Exception {
    final UUID deliveryId = UUID.fromString("6b1d5c0e-2f43-4b8c-9a57-1c1f0d3e8a21");
    when(emailHandoffService.handoffByEmail("actor-h", "ticket-1", "new@example.com"))
        .thenReturn(
            new EmailHandoffOutcome(EmailHandoffOutcome.Status.DEFERRED, null, null, deliveryId));

    mockMvc
        .perform(handoff("new@example.com"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("DEFERRED"))
        .andExpect(jsonPath("$.delivery_id").value(deliveryId.toString()));
  }

  @Test
  void selfTransferIs409() throws Exception {
    when(emailHandoffService.handoffByEmail("actor-h", "ticket-1", "h@example.com"))
        .thenReturn(new EmailHandoffOutcome(EmailHandoffOutcome.Status.SELF_TRANSFER, null, null, null));

    mockMvc
        .perform(handoff("h@example.com"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("SELF_TRANSFER"));
  }

  @Test
  void malformedEmailIs400() throws Exception {
    mockMvc
        .perform(handoff("not-an-email"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    verifyNoInteractions(emailHandoffService);
  }

  @Test
  void bindForAnotherActorIs403() throws Exception {
    mockMvc
        .perform(
            post("/v1/actors/actor-n/deferred-deliveries/bind")
                .header("X-Actor-Id", "actor-x")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"new@example.com\"}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"));
    verifyNoInteractions(emailHandoffService);
  }

  @Test
  void bindReturnsAttachedTickets() throws Exception {
    final TicketRecord ticket =
        new TicketRecord("ticket-1", "event-1", "A-1", "actor-n", "new@example.com", 3L, NOW);
    when(emailHandoffService.bindDeferredDeliveries("actor-n", "new@example.com"))
        .thenReturn(DeferredBindResult.bound("actor-n", List.of(ticket), 1));

    mockMvc
        .perform(
            post("/v1/actors/actor-n/deferred-deliveries/bind")
                .header("X-Actor-Id", "actor-n")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"new@example.com\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deliveries").value(1))
        .andExpect(jsonPath("$.tickets[0].ticket_id").value("ticket-1"));
  }

  @Test
  void bindWithSomeoneElsesEmailIs403() throws Exception {
    when(emailHandoffService.bindDeferredDeliveries("actor-n", "taken@example.com"))
        .thenReturn(DeferredBindResult.emailMismatch("actor-n"));

    mockMvc
        .perform(
            post("/v1/actors/actor-n/deferred-deliveries/bind")
                .header("X-Actor-Id", "actor-n")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"taken@example.com\"}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"));
  }

  private static RequestBuilder handoff(String email) {
    return post("/v1/handoffs/email")
        .header("X-Actor-Id", "actor-h")
        .header("Idempotency-Key", "idem-" + email)
        .contentType(MediaType.APPLICATION_JSON)
        .content("{\"ticket_id\":\"ticket-1\",\"email\":\"" + email + "\"}");
  }
}
