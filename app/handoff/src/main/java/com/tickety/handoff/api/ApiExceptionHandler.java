/*
 * Where: handoff API
 * What: maps exceptions to HTTP error responses
 * Why: every error leaves the service in the same {code, message} shape
 */
package com.tickety.handoff.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(IdempotencyConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleIdempotencyConflict(
      IdempotencyConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.IDEMPOTENCY_KEY_CONFLICT, ex.getMessage()));
  }

  @ExceptionHandler(OperationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleOperationNotFound(OperationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.OPERATION_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(OperationAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleOperationAccessDenied(
      OperationAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse(ApiErrorCode.NOT_AUTHORIZED, ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // the first field message is enough for a client to fix the request
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // parser internals stay out of the response
    return badRequest(resolveUnreadableBodyMessage(ex));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private String resolveUnreadableBodyMessage(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return "request body is required";
    }
    return "request body is invalid";
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
