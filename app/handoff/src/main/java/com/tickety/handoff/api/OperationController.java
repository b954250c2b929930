/*
 * Where: handoff API
 * What: creates pending operations, serves their snapshots and applies transitions
 * Why: both devices drive the handshake through these endpoints
 */
package com.tickety.handoff.api;

import com.tickety.handoff.config.RequestMdcInterceptor;
import com.tickety.handoff.service.CancelOutcome;
import com.tickety.handoff.service.CommandResponse;
import com.tickety.handoff.service.CreateOperationOutcome;
import com.tickety.handoff.service.IdempotentCommandService;
import com.tickety.handoff.service.PendingOperationRelay;
import com.tickety.handoff.service.TransitionOutcome;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/operations")
@RequiredArgsConstructor
@Validated
public class OperationController {

  static final String ACTION_CREATE_OPERATION = "CREATE_OPERATION";

  private final PendingOperationRelay relay;
  private final IdempotentCommandService idempotentCommandService;

  @PostMapping
  public ResponseEntity<Object> create(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @RequestHeader(RequestMdcInterceptor.HEADER_IDEMPOTENCY_KEY)
          @NotBlank(message = "Idempotency-Key is required")
          String idempotencyKey,
      @Valid @RequestBody CreateOperationRequest request) {
    return ApiResponses.toEntity(
        idempotentCommandService.execute(
            idempotencyKey,
            ACTION_CREATE_OPERATION,
            actorId,
            request,
            () -> createOperation(actorId, request)));
  }

  private CommandResponse createOperation(String actorId, CreateOperationRequest request) {
    final CreateOperationOutcome outcome =
        switch (request.kind()) {
          case PAYMENT -> {
            if (request.amountCents() == null) {
              throw new IllegalArgumentException("amount_cents is required for payments");
            }
            yield relay.createPayment(
                actorId,
                request.counterpartyActorId(),
                request.subjectRef(),
                request.amountCents(),
                request.currency(),
                ApiResponses.ttl(request.ttlSeconds()));
          }
          case TRANSFER -> {
            if (request.amountCents() != null || request.currency() != null) {
              throw new IllegalArgumentException("transfers carry no amount");
            }
            yield relay.createTransfer(
                actorId,
                request.counterpartyActorId(),
                request.subjectRef(),
                ApiResponses.ttl(request.ttlSeconds()));
          }
        };
    return switch (outcome.status()) {
      case CREATED ->
          CommandResponse.of(
              HttpStatus.CREATED.value(),
              OperationResponse.from(outcome.operation(), outcome.token()));
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
    };
  }

  @GetMapping("/{operation_id}")
  public OperationResponse get(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @PathVariable("operation_id") UUID operationId) {
    return OperationResponse.from(relay.snapshot(operationId, actorId));
  }

  @GetMapping("/incoming")
  public IncomingOperationsResponse incoming(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId) {
    return new IncomingOperationsResponse(
        actorId, relay.listIncoming(actorId).stream().map(OperationResponse::from).toList());
  }

  @PostMapping("/{operation_id}/acknowledge")
  public ResponseEntity<Object> acknowledge(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @PathVariable("operation_id") UUID operationId) {
    return toEntity(relay.acknowledge(operationId, actorId));
  }

  @PostMapping("/{operation_id}/complete")
  public ResponseEntity<Object> complete(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @PathVariable("operation_id") UUID operationId,
      @Valid @RequestBody CompleteOperationRequest request) {
    return toEntity(relay.complete(operationId, actorId, request.chargeRef()));
  }

  @PostMapping("/{operation_id}/fail")
  public ResponseEntity<Object> fail(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @PathVariable("operation_id") UUID operationId,
      @RequestBody(required = false) FailOperationRequest request) {
    final String reason = request == null ? null : request.reason();
    return toEntity(relay.fail(operationId, actorId, reason));
  }

  @PostMapping("/{operation_id}/cancel")
  public ResponseEntity<Object> cancel(
      @RequestHeader(RequestMdcInterceptor.HEADER_ACTOR_ID)
          @NotBlank(message = "X-Actor-Id is required")
          String actorId,
      @PathVariable("operation_id") UUID operationId) {
    final CancelOutcome outcome = relay.cancel(operationId, actorId);
    return switch (outcome.status()) {
      case CANCELLED -> ResponseEntity.ok(OperationResponse.from(outcome.operation()));
      case NOT_FOUND ->
          ApiResponses.errorEntity(
              HttpStatus.NOT_FOUND, ApiErrorCode.OPERATION_NOT_FOUND, "operation not found");
      case NOT_AUTHORIZED ->
          ApiResponses.errorEntity(
              HttpStatus.FORBIDDEN,
              ApiErrorCode.NOT_AUTHORIZED,
              "only the initiator may cancel");
      case ALREADY_TERMINAL ->
          ApiResponses.errorEntity(
              HttpStatus.CONFLICT,
              ApiErrorCode.ALREADY_TERMINAL,
              "operation is already " + outcome.operation().state());
    };
  }

  private ResponseEntity<Object> toEntity(TransitionOutcome outcome) {
    return switch (outcome.status()) {
      case APPLIED, NO_OP -> ResponseEntity.ok(OperationResponse.from(outcome.operation()));
      case NOT_FOUND ->
          ApiResponses.errorEntity(
              HttpStatus.NOT_FOUND, ApiErrorCode.OPERATION_NOT_FOUND, "operation not found");
      case NOT_AUTHORIZED ->
          ApiResponses.errorEntity(
              HttpStatus.FORBIDDEN,
              ApiErrorCode.NOT_AUTHORIZED,
              "only the counterparty may do this");
      case ILLEGAL_TRANSITION ->
          ApiResponses.errorEntity(
              HttpStatus.CONFLICT,
              ApiErrorCode.ILLEGAL_TRANSITION,
              "operation is " + outcome.operation().state());
      case EXPIRED ->
          ApiResponses.errorEntity(
              HttpStatus.GONE, ApiErrorCode.OPERATION_EXPIRED, "operation expired");
      case INVALID_KIND ->
          ApiResponses.errorEntity(
              HttpStatus.CONFLICT,
              ApiErrorCode.INVALID_OPERATION_KIND,
              "transfers complete through a claim");
    };
  }
}
