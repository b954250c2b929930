/*
 * Where: handoff API
 * What: issues transfer tokens for the QR and link fallbacks
 * Why: a holder without a proximity link still needs a bearer token to hand over
 */
package com.tickety.handoff.api;

import com.tickety.handoff.config.RequestMdcInterceptor;
import com.tickety.handoff.service.CommandResponse;
import com.tickety.handoff.service.IdempotentCommandService;
import com.tickety.handoff.service.IssueOutcome;
import com.tickety.handoff.service.TransferTokenIssuer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class TransferTokenController {

  static final String ACTION_ISSUE_TOKEN = "ISSUE_TOKEN";

  private final TransferTokenIssuer tokenIssuer;
  private final IdempotentCommandService idempotentCommandService;

  @PostMapping("/transfer-tokens")
  public ResponseEntity<Object> issue(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @RequestHeader(RequestMdcInterceptor.HEADER_IDEMPOTENCY_KEY)
          @NotBlank(message = "Idempotency-Key is required")
          String idempotencyKey,
      @Valid @RequestBody IssueTokenRequest request) {
    final CommandResponse response =
        idempotentCommandService.execute(
            idempotencyKey,
            ACTION_ISSUE_TOKEN,
            actorId,
            request,
            () -> issueToken(actorId, request));
    return ApiResponses.toEntity(response);
  }

  private CommandResponse issueToken(String actorId, IssueTokenRequest request) {
    final IssueOutcome outcome =
        tokenIssuer.issue(request.ticketId(), actorId, ApiResponses.ttl(request.ttlSeconds()));
    return switch (outcome.status()) {
      case ISSUED ->
          CommandResponse.of(
              HttpStatus.CREATED.value(), IssueTokenResponse.from(outcome.token()));
      case NOT_FOUND ->
          ApiResponses.error(
              HttpStatus.NOT_FOUND, ApiErrorCode.TICKET_NOT_FOUND, "ticket not found");
      case NOT_OWNER ->
          ApiResponses.error(
              HttpStatus.FORBIDDEN, ApiErrorCode.NOT_OWNER, "ticket is not owned by the caller");
      case ALREADY_LISTED_OR_PENDING ->
          ApiResponses.error(
              HttpStatus.CONFLICT,
              ApiErrorCode.ALREADY_LISTED_OR_PENDING,
              "ticket already has a live transfer");
    };
  }
}
