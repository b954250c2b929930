/*
 * Where: handoff service layer
 * What: creates pending operations and drives their state machine
 * Why: both devices see one authoritative, totally ordered state per operation
 */
package com.tickety.handoff.service;

import com.tickety.common.event.OperationStates;
import com.tickety.handoff.api.OperationAccessDeniedException;
import com.tickety.handoff.api.OperationNotFoundException;
import com.tickety.handoff.config.HandoffOperationProperties;
import com.tickety.handoff.model.OperationState;
import com.tickety.handoff.model.OperationTerms;
import com.tickety.handoff.model.PendingOperationRecord;
import com.tickety.handoff.repository.PendingOperationRepository;
import com.tickety.handoff.repository.TransferTokenRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The pending-operation state machine.
 *
 * <p>Every transition locks the operation row, checks {@link OperationState#canTransitionTo}, then
 * applies a compare-and-swap on state and version and appends exactly one outbox event in the same
 * transaction. Terminal states are final. A transfer that ends in anything but COMPLETED also
 * closes its token, so a finished operation never leaves a redeemable token behind.
 */
@Service
@RequiredArgsConstructor
public class PendingOperationRelay {

  private static final Logger logger = LoggerFactory.getLogger(PendingOperationRelay.class);
  private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");
  static final String REASON_COUNTERPARTY_REPORTED = "counterparty_reported";

  private final PendingOperationRepository operationRepository;
  private final TransferTokenRepository tokenRepository;
  private final TransferTokenIssuer tokenIssuer;
  private final OperationEventRecorder eventRecorder;
  private final HandoffOperationProperties operationProperties;
  private final HandoffMetrics metrics;
  private final ApplicationEventPublisher applicationEventPublisher;
  private final Clock clock;

  @Transactional
  public CreateOperationOutcome createPayment(
      String initiatorActorId,
      String counterpartyActorId,
      String subjectRef,
      long amountCents,
      String currency,
      Duration requestedTtl) {
    requireText(counterpartyActorId, "counterparty_actor_id is required for payments");
    requireText(subjectRef, "subject_ref is required");
    if (amountCents <= 0) {
      throw new IllegalArgumentException("amount_cents must be positive");
    }
    if (currency == null || !CURRENCY.matcher(currency).matches()) {
      throw new IllegalArgumentException("currency must be an ISO 4217 code");
    }
    if (initiatorActorId.equals(counterpartyActorId)) {
      throw new IllegalArgumentException("initiator and counterparty must differ");
    }
    final Instant now = Instant.now(clock);
    final Duration ttl = operationProperties.resolveTtl(requestedTtl);
    final PendingOperationRecord operation =
        new PendingOperationRecord(
            UUID.randomUUID(),
            new OperationTerms.Payment(amountCents, currency),
            initiatorActorId,
            counterpartyActorId,
            subjectRef,
            OperationState.PENDING,
            null,
            null,
            now,
            now,
            now.plus(ttl),
            1L);
    return new CreateOperationOutcome(
        CreateOperationOutcome.Status.CREATED, insertCreated(operation), null);
  }

  /** Issues the transfer token and creates the operation in one transaction. */
  @Transactional
  public CreateOperationOutcome createTransfer(
      String initiatorActorId, String counterpartyActorId, String ticketId, Duration requestedTtl) {
    requireText(ticketId, "subject_ref is required");
    if (initiatorActorId.equals(counterpartyActorId)) {
      throw new IllegalArgumentException("initiator and counterparty must differ");
    }
    final IssueOutcome issued =
        tokenIssuer.issue(ticketId, initiatorActorId, operationProperties.resolveTtl(requestedTtl));
    if (!issued.isIssued()) {
      return CreateOperationOutcome.rejected(issued.status());
    }
    final PendingOperationRecord operation =
        new PendingOperationRecord(
            UUID.randomUUID(),
            new OperationTerms.Transfer(issued.token().tokenId()),
            initiatorActorId,
            counterpartyActorId,
            ticketId,
            OperationState.PENDING,
            null,
            null,
            issued.token().issuedAt(),
            issued.token().issuedAt(),
            issued.token().expiresAt(),
            1L);
    return new CreateOperationOutcome(
        CreateOperationOutcome.Status.CREATED, insertCreated(operation), issued.token());
  }

  private PendingOperationRecord insertCreated(PendingOperationRecord operation) {
    operationRepository.insert(operation);
    eventRecorder.recordStateChange(operation);
    metrics.recordTransition(OperationState.PENDING);
    applicationEventPublisher.publishEvent(
        new OperationCreatedEvent(operation.operationId(), operation.expiresAt()));
    logger.info(
        "pending operation created operationId={} kind={} initiator={} counterparty={}"
            + " expiresAt={}",
        operation.operationId(),
        operation.kind(),
        operation.initiatorActorId(),
        operation.counterpartyActorId(),
        operation.expiresAt());
    return operation;
  }

  @Transactional
  public TransitionOutcome acknowledge(UUID operationId, String actorId) {
    final Optional<PendingOperationRecord> locked = operationRepository.lockById(operationId);
    if (locked.isEmpty()) {
      return TransitionOutcome.of(TransitionOutcome.Status.NOT_FOUND, null);
    }
    final PendingOperationRecord operation = locked.get();
    if (!isCounterparty(operation, actorId)) {
      return TransitionOutcome.of(TransitionOutcome.Status.NOT_AUTHORIZED, operation);
    }
    return guardedTransition(operation, OperationState.PROCESSING, null, null);
  }

  /** Payment completion reported by the counterparty; transfers complete through the claim path. */
  @Transactional
  public TransitionOutcome complete(UUID operationId, String actorId, String chargeRef) {
    final Optional<PendingOperationRecord> locked = operationRepository.lockById(operationId);
    if (locked.isEmpty()) {
      return TransitionOutcome.of(TransitionOutcome.Status.NOT_FOUND, null);
    }
    final PendingOperationRecord operation = locked.get();
    if (!isCounterparty(operation, actorId)) {
      return TransitionOutcome.of(TransitionOutcome.Status.NOT_AUTHORIZED, operation);
    }
    return switch (operation.kind()) {
      case PAYMENT -> guardedTransition(operation, OperationState.COMPLETED, null, chargeRef);
      case TRANSFER -> TransitionOutcome.of(TransitionOutcome.Status.INVALID_KIND, operation);
    };
  }

  @Transactional
  public TransitionOutcome fail(UUID operationId, String actorId, String reason) {
    final Optional<PendingOperationRecord> locked = operationRepository.lockById(operationId);
    if (locked.isEmpty()) {
      return TransitionOutcome.of(TransitionOutcome.Status.NOT_FOUND, null);
    }
    final PendingOperationRecord operation = locked.get();
    if (!isCounterparty(operation, actorId)) {
      return TransitionOutcome.of(TransitionOutcome.Status.NOT_AUTHORIZED, operation);
    }
    return guardedTransition(operation, OperationState.FAILED, sanitizeReason(reason), null);
  }

  @Transactional
  public CancelOutcome cancel(UUID operationId, String actorId) {
    final Optional<PendingOperationRecord> locked = operationRepository.lockById(operationId);
    if (locked.isEmpty()) {
      return new CancelOutcome(CancelOutcome.Status.NOT_FOUND, null);
    }
    final PendingOperationRecord operation = locked.get();
    if (!operation.initiatorActorId().equals(actorId)) {
      return new CancelOutcome(CancelOutcome.Status.NOT_AUTHORIZED, operation);
    }
    if (operation.isTerminal()) {
      return new CancelOutcome(CancelOutcome.Status.ALREADY_TERMINAL, operation);
    }
    final Instant now = Instant.now(clock);
    if (operation.isPastWindow(now)) {
      return new CancelOutcome(
          CancelOutcome.Status.ALREADY_TERMINAL, expireLocked(operation, now));
    }
    final PendingOperationRecord cancelled =
        transitionLocked(
            operation,
            OperationState.CANCELLED,
            OperationStates.REASON_CANCELLED_BY_INITIATOR,
            null,
            null,
            now);
    return new CancelOutcome(CancelOutcome.Status.CANCELLED, cancelled);
  }

  /** Alarm entry point; a no-op unless the operation is open and past its window. */
  @Transactional
  public boolean expireIfDue(UUID operationId) {
    final Optional<PendingOperationRecord> locked = operationRepository.lockById(operationId);
    if (locked.isEmpty() || locked.get().isTerminal()) {
      return false;
    }
    final Instant now = Instant.now(clock);
    if (!locked.get().isPastWindow(now)) {
      return false;
    }
    expireLocked(locked.get(), now);
    return true;
  }

  public PendingOperationRecord snapshot(UUID operationId, String viewerActorId) {
    final PendingOperationRecord operation =
        operationRepository
            .findById(operationId)
            .orElseThrow(() -> new OperationNotFoundException(operationId));
    if (!operation.initiatorActorId().equals(viewerActorId)
        && !isCounterparty(operation, viewerActorId)) {
      throw new OperationAccessDeniedException(operationId);
    }
    return operation;
  }

  public List<PendingOperationRecord> listIncoming(String counterpartyActorId) {
    return operationRepository.findIncoming(counterpartyActorId, Instant.now(clock));
  }

  /**
   * Moves a locked open transfer to COMPLETED after its token was redeemed, passing through
   * PROCESSING when the counterparty had not acknowledged yet.
   */
  PendingOperationRecord completeTransferLocked(
      PendingOperationRecord operation, String claimantActorId, Instant now) {
    PendingOperationRecord current = operation;
    if (current.state() == OperationState.PENDING) {
      current = transitionLocked(current, OperationState.PROCESSING, null, claimantActorId, null, now);
    }
    return transitionLocked(current, OperationState.COMPLETED, null, claimantActorId, null, now);
  }

  PendingOperationRecord failLocked(PendingOperationRecord operation, String reason, Instant now) {
    return transitionLocked(operation, OperationState.FAILED, reason, null, null, now);
  }

  PendingOperationRecord expireLocked(PendingOperationRecord operation, Instant now) {
    return transitionLocked(
        operation, OperationState.EXPIRED, OperationStates.REASON_EXPIRED, null, null, now);
  }

  /** Follow-up for rows the batch sweep already moved to EXPIRED. */
  void onSweptExpired(PendingOperationRecord expired, Instant now) {
    eventRecorder.recordStateChange(expired);
    closeToken(expired, now);
    metrics.recordTransition(OperationState.EXPIRED);
    applicationEventPublisher.publishEvent(
        new OperationClosedEvent(expired.operationId(), expired.state()));
    logger.info(
        "pending operation expired by sweep operationId={} sequence={}",
        expired.operationId(),
        expired.version());
  }

  private TransitionOutcome guardedTransition(
      PendingOperationRecord operation, OperationState target, String reason, String chargeRef) {
    if (operation.state() == target) {
      return TransitionOutcome.of(TransitionOutcome.Status.NO_OP, operation);
    }
    if (operation.isTerminal()) {
      return TransitionOutcome.of(TransitionOutcome.Status.ILLEGAL_TRANSITION, operation);
    }
    final Instant now = Instant.now(clock);
    if (operation.isPastWindow(now)) {
      return TransitionOutcome.of(
          TransitionOutcome.Status.EXPIRED, expireLocked(operation, now));
    }
    if (!operation.state().canTransitionTo(target)) {
      return TransitionOutcome.of(TransitionOutcome.Status.ILLEGAL_TRANSITION, operation);
    }
    return TransitionOutcome.of(
        TransitionOutcome.Status.APPLIED,
        transitionLocked(operation, target, reason, null, chargeRef, now));
  }

  private PendingOperationRecord transitionLocked(
      PendingOperationRecord operation,
      OperationState target,
      String reason,
      String counterpartyActorId,
      String chargeRef,
      Instant now) {
    if (!operation.state().canTransitionTo(target)) {
      throw new IllegalStateException(
          "illegal transition " + operation.state() + " -> " + target);
    }
    final PendingOperationRecord updated =
        operationRepository
            .transition(
                operation.operationId(),
                operation.state(),
                operation.version(),
                target,
                reason,
                counterpartyActorId,
                chargeRef,
                now)
            .orElseThrow(() -> new IllegalStateException("operation changed under lock"));
    eventRecorder.recordStateChange(updated);
    if (target.isTerminal()) {
      closeToken(updated, now);
      applicationEventPublisher.publishEvent(
          new OperationClosedEvent(updated.operationId(), target));
    }
    metrics.recordTransition(target);
    logger.info(
        "pending operation transition operationId={} from={} to={} sequence={} reason={}",
        updated.operationId(),
        operation.state(),
        target,
        updated.version(),
        reason);
    return updated;
  }

  private void closeToken(PendingOperationRecord operation, Instant now) {
    if (!(operation.terms() instanceof OperationTerms.Transfer transfer)
        || operation.state() == OperationState.COMPLETED) {
      return;
    }
    if (operation.state() == OperationState.EXPIRED) {
      tokenRepository.expireIfActive(transfer.tokenId(), now);
    } else {
      tokenIssuer.revoke(transfer.tokenId());
    }
  }

  private boolean isCounterparty(PendingOperationRecord operation, String actorId) {
    return operation.counterpartyActorId() != null
        && Objects.equals(operation.counterpartyActorId(), actorId);
  }

  private String sanitizeReason(String reason) {
    if (reason == null || reason.isBlank()) {
      return REASON_COUNTERPARTY_REPORTED;
    }
    final String trimmed = reason.strip();
    final int maxLength = operationProperties.failureReasonMaxLength();
    return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength);
  }

  private static void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
