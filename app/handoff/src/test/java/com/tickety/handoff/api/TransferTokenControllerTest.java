/*
 * Where: TransferTokenController web layer test
 * What: token issue responses and idempotent replay handling
 * Why: a retried issue must return the same token instead of minting a second one
 */
package com.tickety.handoff.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tickety.handoff.model.TokenStatus;
import com.tickety.handoff.model.TransferTokenRecord;
import com.tickety.handoff.service.CommandResponse;
import com.tickety.handoff.service.IdempotentCommandService;
import com.tickety.handoff.service.IssueOutcome;
import com.tickety.handoff.service.TransferTokenIssuer;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.RequestBuilder;

@WebMvcTest(TransferTokenController.class)
@Import(ApiExceptionHandler.class)
class TransferTokenControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TransferTokenIssuer tokenIssuer;
  @MockitoBean private IdempotentCommandService idempotentCommandService;

  @Test
  void issueReturns201WithFullToken() throws Exception {
    runCommandsDirectly();
    final Instant issuedAt = Instant.parse("2026-03-01T10:00:00Z");
    final TransferTokenRecord token =
        new TransferTokenRecord(
            "b".repeat(64),
            "ticket-1",
            "actor-h",
            TokenStatus.ACTIVE,
            issuedAt,
            issuedAt.plusSeconds(120),
            null,
            null);
    when(tokenIssuer.issue("ticket-1", "actor-h", Duration.ofSeconds(120)))
        .thenReturn(new IssueOutcome(IssueOutcome.Status.ISSUED, token));

    mockMvc
        .perform(
            post("/v1/transfer-tokens")
                .header("X-Actor-Id", "actor-h")
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ticket_id\":\"ticket-1\",\"ttl_seconds\":120}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.transfer_token").value("b".repeat(64)))
        .andExpect(jsonPath("$.ticket_id").value("ticket-1"))
        .andExpect(jsonPath("$.expires_at").value("2026-03-01T10:02:00Z"));
    verify(idempotentCommandService)
        .execute(
            eq("idem-1"),
            eq(TransferTokenController.ACTION_ISSUE_TOKEN),
            eq("actor-h"),
            any(IssueTokenRequest.class),
            any());
  }

  @Test
  void liveTokenIs409() throws Exception {
    runCommandsDirectly();
    when(tokenIssuer.issue(eq("ticket-1"), eq("actor-h"), isNull()))
        .thenReturn(new IssueOutcome(IssueOutcome.Status.ALREADY_LISTED_OR_PENDING, null));

    mockMvc
        .perform(issue("idem-2", "{\"ticket_id\":\"ticket-1\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALREADY_LISTED_OR_PENDING"));
  }

  @Test
  void nonPositiveTtlIs400() throws Exception {
    mockMvc
        .perform(issue("idem-3", "{\"ticket_id\":\"ticket-1\",\"ttl_seconds\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("ttl_seconds must be positive"));
  }

  @Test
  void reusedKeyWithDifferentRequestIs409() throws Exception {
    when(idempotentCommandService.execute(anyString(), anyString(), anyString(), any(), any()))
        .thenThrow(new IdempotencyConflictException("Idempotency-Key reused with a different request"));

    mockMvc
        .perform(issue("idem-4", "{\"ticket_id\":\"ticket-2\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("IDEMPOTENCY_KEY_CONFLICT"));
  }

  @Test
  void replayedResponseIsReturnedAsStored() throws Exception {
    when(idempotentCommandService.execute(anyString(), anyString(), anyString(), any(), any()))
        .thenReturn(
            CommandResponse.of(
                404, new ApiErrorResponse(ApiErrorCode.TICKET_NOT_FOUND, "ticket not found")));

    mockMvc
        .perform(issue("idem-5", "{\"ticket_id\":\"ticket-9\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("TICKET_NOT_FOUND"));
  }

  private void runCommandsDirectly() {
    when(idempotentCommandService.execute(anyString(), anyString(), anyString(), any(), any()))
        .thenAnswer(invocation -> invocation.<Supplier<CommandResponse>>getArgument(4).get());
  }

  private static RequestBuilder issue(String idempotencyKey, String body) {
    return post("/v1/transfer-tokens")
        .header("X-Actor-Id", "actor-h")
        .header("Idempotency-Key", idempotencyKey)
        .contentType(MediaType.APPLICATION_JSON)
        .content(body);
  }
}
