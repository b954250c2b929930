/*
 * Where: handoff service layer
 * What: issues, redeems and revokes transfer tokens
 * Why: redemption is the only path that moves ticket ownership through a token
 */
package com.tickety.handoff.service;

import com.tickety.handoff.config.HandoffTokenProperties;
import com.tickety.handoff.model.TicketRecord;
import com.tickety.handoff.model.TokenStatus;
import com.tickety.handoff.model.TransferTokenRecord;
import com.tickety.handoff.repository.PendingOperationRepository;
import com.tickety.handoff.repository.TicketRepository;
import com.tickety.handoff.repository.TransferTokenRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the transfer token lifecycle.
 *
 * <p>Every mutating path locks the ticket row first. Redemption then performs a compare-and-swap
 * that only matches an ACTIVE token inside its window, so concurrent redeemers of one token see
 * exactly one {@link RedeemOutcome.Status#REDEEMED}. A token is expired from {@code expiresAt}
 * onwards, measured on the relay clock.
 */
@Service
@RequiredArgsConstructor
public class TransferTokenIssuer {

  private static final Logger logger = LoggerFactory.getLogger(TransferTokenIssuer.class);
  private static final int TOKEN_BYTES = 32;

  private final SecureRandom secureRandom = new SecureRandom();
  private final TicketRepository ticketRepository;
  private final TransferTokenRepository tokenRepository;
  private final PendingOperationRepository operationRepository;
  private final HandoffTokenProperties tokenProperties;
  private final HandoffMetrics metrics;
  private final Clock clock;

  @Transactional
  public IssueOutcome issue(String ticketId, String holderActorId, Duration requestedTtl) {
    final Instant now = Instant.now(clock);
    final Optional<TicketRecord> ticket = ticketRepository.lockById(ticketId);
    if (ticket.isEmpty()) {
      return reject(IssueOutcome.Status.NOT_FOUND, ticketId, holderActorId);
    }
    final Optional<IssueOutcome.Status> blocked = checkTransferable(ticket.get(), holderActorId, now);
    if (blocked.isPresent()) {
      return reject(blocked.get(), ticketId, holderActorId);
    }
    final Duration ttl = tokenProperties.resolveTtl(requestedTtl);
    final TransferTokenRecord token =
        new TransferTokenRecord(
            newTokenId(), ticketId, holderActorId, TokenStatus.ACTIVE, now, now.plus(ttl), null, null);
    tokenRepository.insert(token);
    metrics.recordTokenIssue(IssueOutcome.Status.ISSUED);
    logger.info(
        "transfer token issued tokenId={} ticketId={} holder={} expiresAt={}",
        token.shortId(),
        ticketId,
        holderActorId,
        token.expiresAt());
    return IssueOutcome.issued(token);
  }

  /**
   * Checks whether {@code holderActorId} may hand the locked ticket on right now. Stale ACTIVE
   * tokens past their window are expired as a side effect.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<IssueOutcome.Status> checkTransferable(
      TicketRecord lockedTicket, String holderActorId, Instant now) {
    if (!lockedTicket.isOwnedBy(holderActorId)) {
      return Optional.of(IssueOutcome.Status.NOT_OWNER);
    }
    tokenRepository.expireStaleForTicket(lockedTicket.ticketId(), now);
    if (tokenRepository.findActiveByTicket(lockedTicket.ticketId()).isPresent()
        || operationRepository.hasOpenTransferForTicket(lockedTicket.ticketId(), now)) {
      return Optional.of(IssueOutcome.Status.ALREADY_LISTED_OR_PENDING);
    }
    return Optional.empty();
  }

  @Transactional
  public RedeemOutcome redeem(String tokenId, String claimantActorId) {
    final Instant now = Instant.now(clock);
    final Optional<TransferTokenRecord> found = tokenRepository.findById(tokenId);
    if (found.isEmpty()) {
      return RedeemOutcome.notFound();
    }
    final TicketRecord ticket =
        ticketRepository
            .lockById(found.get().ticketId())
            .orElseThrow(() -> new IllegalStateException("token without ticket"));
    // re-read under the ticket lock; another redeemer may have finished meanwhile
    final TransferTokenRecord token =
        tokenRepository.findById(tokenId).orElseThrow(IllegalStateException::new);
    final RedeemOutcome outcome = redeemLocked(token, ticket, claimantActorId, now);
    logger.info(
        "transfer token redeem tokenId={} ticketId={} claimant={} outcome={}",
        token.shortId(),
        ticket.ticketId(),
        claimantActorId,
        outcome.status());
    return outcome;
  }

  private RedeemOutcome redeemLocked(
      TransferTokenRecord token, TicketRecord ticket, String claimantActorId, Instant now) {
    final RedeemOutcome.Status closed =
        switch (token.status()) {
          case REDEEMED -> RedeemOutcome.Status.ALREADY_REDEEMED;
          case REVOKED -> RedeemOutcome.Status.REVOKED;
          case EXPIRED -> RedeemOutcome.Status.EXPIRED;
          case ACTIVE -> null;
        };
    if (closed != null) {
      return new RedeemOutcome(closed, token, ticket);
    }
    if (token.isPastWindow(now)) {
      tokenRepository.expireIfActive(token.tokenId(), now);
      return new RedeemOutcome(RedeemOutcome.Status.EXPIRED, token, ticket);
    }
    if (ticket.isOwnedBy(claimantActorId)) {
      return new RedeemOutcome(RedeemOutcome.Status.SELF_TRANSFER, token, ticket);
    }
    if (!ticket.isOwnedBy(token.holderActorId())) {
      return new RedeemOutcome(RedeemOutcome.Status.NOT_OWNER, token, ticket);
    }
    final Optional<TransferTokenRecord> redeemed =
        tokenRepository.redeemIfActive(token.tokenId(), claimantActorId, now);
    if (redeemed.isEmpty()) {
      return new RedeemOutcome(RedeemOutcome.Status.ALREADY_REDEEMED, token, ticket);
    }
    final TicketRecord transferred =
        ticketRepository
            .transferOwnership(ticket.ticketId(), token.holderActorId(), claimantActorId, now)
            .orElseThrow(() -> new IllegalStateException("ticket owner changed under lock"));
    return new RedeemOutcome(RedeemOutcome.Status.REDEEMED, redeemed.get(), transferred);
  }

  /** Revokes a live token; false when it had already left ACTIVE. */
  @Transactional(propagation = Propagation.MANDATORY)
  public boolean revoke(String tokenId) {
    final boolean revoked = tokenRepository.revokeIfActive(tokenId, Instant.now(clock));
    if (revoked) {
      logger.info("transfer token revoked tokenId={}", TransferTokenRecord.shorten(tokenId));
    }
    return revoked;
  }

  public Optional<TransferTokenRecord> findLive(String ticketId) {
    final Instant now = Instant.now(clock);
    return tokenRepository.findActiveByTicket(ticketId).filter(token -> !token.isPastWindow(now));
  }

  private IssueOutcome reject(IssueOutcome.Status status, String ticketId, String holderActorId) {
    metrics.recordTokenIssue(status);
    logger.info(
        "transfer token issue rejected ticketId={} holder={} outcome={}",
        ticketId,
        holderActorId,
        status);
    return IssueOutcome.rejected(status);
  }

  private String newTokenId() {
    final byte[] bytes = new byte[TOKEN_BYTES];
    secureRandom.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
