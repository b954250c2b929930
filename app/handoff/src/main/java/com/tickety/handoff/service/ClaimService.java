/*
 * Where: handoff service layer
 * What: the receiving party's claim of a transfer token or pending transfer
 * Why: redemption and the operation outcome must be decided together, exactly once
 */
package com.tickety.handoff.service;

import com.tickety.common.event.OperationStates;
import com.tickety.handoff.model.OperationState;
import com.tickety.handoff.model.PendingOperationRecord;
import com.tickety.handoff.model.TransferTokenRecord;
import com.tickety.handoff.repository.ActorRepository;
import com.tickety.handoff.repository.PendingOperationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Claim endpoint logic.
 *
 * <p>Locks are taken in the order operation, ticket, token, the same order cancellation uses.
 * Claiming is idempotent for the winner: the claimant that already redeemed a token gets the same
 * ticket back, flagged as replayed. Everyone else sees the rejection that applies.
 */
@Service
@RequiredArgsConstructor
public class ClaimService {

  private static final Logger logger = LoggerFactory.getLogger(ClaimService.class);

  private final PendingOperationRepository operationRepository;
  private final ActorRepository actorRepository;
  private final TransferTokenIssuer tokenIssuer;
  private final PendingOperationRelay relay;
  private final HandoffMetrics metrics;
  private final Clock clock;

  @Transactional
  public ClaimResult claimByToken(String tokenId, String claimantActorId) {
    final ClaimResult result = claimLocked(tokenId, claimantActorId);
    metrics.recordClaim(result.status());
    logger.info(
        "claim processed tokenId={} claimant={} operationId={} outcome={} replayed={}",
        TransferTokenRecord.shorten(tokenId),
        claimantActorId,
        result.operationId(),
        result.status(),
        result.replayed());
    return result;
  }

  private ClaimResult claimLocked(String tokenId, String claimantActorId) {
    final Optional<PendingOperationRecord> locked = operationRepository.lockByTokenId(tokenId);
    final PendingOperationRecord operation = locked.orElse(null);
    final UUID operationId = operation == null ? null : operation.operationId();
    if (operation != null) {
      if (operation.state() == OperationState.CANCELLED) {
        return ClaimResult.rejected(ClaimResult.Status.OPERATION_CANCELLED, null, operationId);
      }
      if (operation.counterpartyActorId() != null
          && !operation.counterpartyActorId().equals(claimantActorId)) {
        return ClaimResult.rejected(ClaimResult.Status.NOT_AUTHORIZED, null, operationId);
      }
    }
    final RedeemOutcome redeemed = tokenIssuer.redeem(tokenId, claimantActorId);
    final Instant now = Instant.now(clock);
    final boolean open = operation != null && !operation.isTerminal();
    return switch (redeemed.status()) {
      case REDEEMED -> {
        if (open) {
          relay.completeTransferLocked(operation, claimantActorId, now);
        }
        yield new ClaimResult(ClaimResult.Status.CLAIMED, redeemed.ticket(), operationId, false);
      }
      case ALREADY_REDEEMED -> {
        if (claimantActorId.equals(redeemed.token().redeemedBy())) {
          yield new ClaimResult(ClaimResult.Status.CLAIMED, redeemed.ticket(), operationId, true);
        }
        if (open) {
          relay.failLocked(operation, OperationStates.REASON_ALREADY_REDEEMED, now);
        }
        yield ClaimResult.rejected(ClaimResult.Status.ALREADY_REDEEMED, null, operationId);
      }
      case NOT_OWNER -> {
        if (open) {
          relay.failLocked(operation, OperationStates.REASON_NOT_OWNER, now);
        }
        yield ClaimResult.rejected(ClaimResult.Status.NOT_OWNER, null, operationId);
      }
      case EXPIRED -> {
        if (open) {
          relay.expireLocked(operation, now);
        }
        yield ClaimResult.rejected(ClaimResult.Status.EXPIRED, null, operationId);
      }
      case REVOKED -> ClaimResult.rejected(ClaimResult.Status.REVOKED, null, operationId);
      case SELF_TRANSFER ->
          ClaimResult.rejected(ClaimResult.Status.SELF_TRANSFER, redeemed.ticket(), operationId);
      case NOT_FOUND -> ClaimResult.rejected(ClaimResult.Status.NOT_FOUND, null, null);
    };
  }

  /** Resolves a handoff recipient without revealing anything beyond registered or not. */
  public CounterpartyResolution claimByEmailLookup(String email) {
    if (email == null || email.isBlank() || !email.contains("@")) {
      throw new IllegalArgumentException("email is invalid");
    }
    final String normalized = ActorRepository.normalizeEmail(email);
    return actorRepository
        .findActorIdByEmail(normalized)
        .map(
            actorId ->
                new CounterpartyResolution(
                    CounterpartyResolution.Kind.REGISTERED, actorId, normalized))
        .orElseGet(
            () ->
                new CounterpartyResolution(
                    CounterpartyResolution.Kind.UNREGISTERED, null, normalized));
  }
}
