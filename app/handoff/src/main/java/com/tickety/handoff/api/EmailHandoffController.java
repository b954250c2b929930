/*
 * Where: handoff API
 * What: email handoff and first-login binding of deferred deliveries
 * Why: the fallback when neither proximity nor QR can reach the recipient
 */
package com.tickety.handoff.api;

import com.tickety.handoff.config.RequestMdcInterceptor;
import com.tickety.handoff.service.CommandResponse;
import com.tickety.handoff.service.DeferredBindResult;
import com.tickety.handoff.service.EmailHandoffOutcome;
import com.tickety.handoff.service.EmailHandoffService;
import com.tickety.handoff.service.IdempotentCommandService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class EmailHandoffController {

  static final String ACTION_EMAIL_HANDOFF = "EMAIL_HANDOFF";

  private final EmailHandoffService emailHandoffService;
  private final IdempotentCommandService idempotentCommandService;

  @PostMapping("/handoffs/email")
  public ResponseEntity<Object> handoff(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @RequestHeader(RequestMdcInterceptor.HEADER_IDEMPOTENCY_KEY)
          @NotBlank(message = "Idempotency-Key is required")
          String idempotencyKey,
      @Valid @RequestBody EmailHandoffRequest request) {
    return ApiResponses.toEntity(
        idempotentCommandService.execute(
            idempotencyKey,
            ACTION_EMAIL_HANDOFF,
            actorId,
            request,
            () -> handoffByEmail(actorId, request)));
  }

  private CommandResponse handoffByEmail(String actorId, EmailHandoffRequest request) {
    final EmailHandoffOutcome outcome =
        emailHandoffService.handoffByEmail(actorId, request.ticketId(), request.email());
    return switch (outcome.status()) {
      case DELIVERED ->
          CommandResponse.of(HttpStatus.OK.value(), EmailHandoffResponse.from(outcome));
      case DEFERRED ->
          CommandResponse.of(HttpStatus.ACCEPTED.value(), EmailHandoffResponse.from(outcome));
      case TICKET_NOT_FOUND ->
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
      case SELF_TRANSFER ->
          ApiResponses.error(
              HttpStatus.CONFLICT, ApiErrorCode.SELF_TRANSFER, "recipient already owns the ticket");
    };
  }

  @PostMapping("/actors/{actor_id}/deferred-deliveries/bind")
  public ResponseEntity<Object> bind(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String callerActorId,
      @PathVariable("actor_id") String actorId,
      @Valid @RequestBody BindDeferredRequest request) {
    if (!actorId.equals(callerActorId)) {
      return ApiResponses.errorEntity(
          HttpStatus.FORBIDDEN, ApiErrorCode.NOT_AUTHORIZED, "actors may only bind for themselves");
    }
    final DeferredBindResult result =
        emailHandoffService.bindDeferredDeliveries(actorId, request.email());
    return switch (result.status()) {
      case BOUND -> ResponseEntity.ok(BindDeferredResponse.from(result));
      case EMAIL_MISMATCH ->
          ApiResponses.errorEntity(
              HttpStatus.FORBIDDEN,
              ApiErrorCode.NOT_AUTHORIZED,
              "email is registered to another actor");
    };
  }
}
