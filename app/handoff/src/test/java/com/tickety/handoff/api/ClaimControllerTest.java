/*
 * Where: ClaimController web layer test
 * What: claim responses carry the ticket or a wire error, with matching status codes
 * Why: the receiving device maps these codes straight to what it shows
 */
package com.tickety.handoff.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tickety.handoff.model.TicketRecord;
import com.tickety.handoff.service.ClaimResult;
import com.tickety.handoff.service.ClaimService;
import com.tickety.handoff.service.CounterpartyResolution;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.RequestBuilder;

@WebMvcTest(ClaimController.class)
@Import(ApiExceptionHandler.class)
class ClaimControllerTest {

  private static final String TOKEN = "a".repeat(64);

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ClaimService claimService;

  @Test
  void successfulClaimReturnsTicket() throws Exception {
    final UUID operationId = UUID.randomUUID();
    final TicketRecord ticket =
        new TicketRecord(
            "ticket-1", "event-1", "A-1", "actor-r", null, 4L, Instant.parse("2026-03-01T10:00:00Z"));
    when(claimService.claimByToken(TOKEN, "actor-r"))
        .thenReturn(new ClaimResult(ClaimResult.Status.CLAIMED, ticket, operationId, false));

    mockMvc
        .perform(claim("actor-r"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ticket.ticket_id").value("ticket-1"))
        .andExpect(jsonPath("$.ticket.owner_actor_id").value("actor-r"))
        .andExpect(jsonPath("$.operation_id").value(operationId.toString()))
        .andExpect(jsonPath("$.replayed").value(false))
        .andExpect(jsonPath("$.error").doesNotExist());
  }

  @Test
  void expiredClaimIs410WithWireError() throws Exception {
    when(claimService.claimByToken(TOKEN, "actor-r"))
        .thenReturn(new ClaimResult(ClaimResult.Status.EXPIRED, null, null, false));

    mockMvc
        .perform(claim("actor-r"))
        .andExpect(status().isGone())
        .andExpect(jsonPath("$.error").value("expired"))
        .andExpect(jsonPath("$.ticket").doesNotExist());
  }

  @Test
  void alreadyRedeemedIs409() throws Exception {
    when(claimService.claimByToken(TOKEN, "actor-late"))
        .thenReturn(new ClaimResult(ClaimResult.Status.ALREADY_REDEEMED, null, null, false));

    mockMvc
        .perform(claim("actor-late"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("already_redeemed"));
  }

  @Test
  void missingTokenIs400() throws Exception {
    mockMvc
        .perform(
            post("/v1/claims")
                .header("X-Actor-Id", "actor-r")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("transfer_token is required"));
  }

  @Test
  void emailLookupReturnsRegistrationStatus() throws Exception {
    when(claimService.claimByEmailLookup("new@example.com"))
        .thenReturn(
            new CounterpartyResolution(
                CounterpartyResolution.Kind.UNREGISTERED, null, "new@example.com"));

    mockMvc
        .perform(
            post("/v1/claims/email-lookup")
                .header("X-Actor-Id", "actor-m")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\":\"new@example.com\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UNREGISTERED"))
        .andExpect(jsonPath("$.actor_id").doesNotExist());
  }

  private static RequestBuilder claim(String actorId) {
    return post("/v1/claims")
        .header("X-Actor-Id", actorId)
        .contentType(MediaType.APPLICATION_JSON)
        .content("{\"transfer_token\":\"" + TOKEN + "\"}");
  }
}
