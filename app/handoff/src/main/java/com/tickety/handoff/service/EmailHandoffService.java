/*
 * Where: handoff service layer
 * What: hands a ticket to an email address and binds parked tickets on first login
 * Why: the recipient of a handoff may not have an account yet
 */
package com.tickety.handoff.service;

import com.tickety.handoff.model.DeferredDeliveryRecord;
import com.tickety.handoff.model.TicketRecord;
import com.tickety.handoff.repository.ActorRepository;
import com.tickety.handoff.repository.DeferredDeliveryRepository;
import com.tickety.handoff.repository.TicketRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class EmailHandoffService {

  private static final Logger logger = LoggerFactory.getLogger(EmailHandoffService.class);

  private final ClaimService claimService;
  private final TransferTokenIssuer tokenIssuer;
  private final TicketRepository ticketRepository;
  private final ActorRepository actorRepository;
  private final DeferredDeliveryRepository deferredDeliveryRepository;
  private final OperationEventRecorder eventRecorder;
  private final Clock clock;

  @Transactional
  public EmailHandoffOutcome handoffByEmail(
      String initiatorActorId, String ticketId, String email) {
    final CounterpartyResolution recipient = claimService.claimByEmailLookup(email);
    final Instant now = Instant.now(clock);
    final Optional<TicketRecord> locked = ticketRepository.lockById(ticketId);
    if (locked.isEmpty()) {
      return EmailHandoffOutcome.rejected(EmailHandoffOutcome.Status.TICKET_NOT_FOUND);
    }
    final Optional<IssueOutcome.Status> blocked =
        tokenIssuer.checkTransferable(locked.get(), initiatorActorId, now);
    if (blocked.isPresent()) {
      return EmailHandoffOutcome.rejected(
          switch (blocked.get()) {
            case NOT_OWNER -> EmailHandoffOutcome.Status.NOT_OWNER;
            case ALREADY_LISTED_OR_PENDING -> EmailHandoffOutcome.Status.ALREADY_LISTED_OR_PENDING;
            case NOT_FOUND, ISSUED -> throw new IllegalStateException(
                "unexpected transfer check " + blocked.get());
          });
    }
    return switch (recipient.kind()) {
      case REGISTERED -> deliverInBand(ticketId, initiatorActorId, recipient.actorId(), now);
      case UNREGISTERED -> deferToEmail(ticketId, initiatorActorId, recipient.email(), now);
    };
  }

  private EmailHandoffOutcome deliverInBand(
      String ticketId, String initiatorActorId, String recipientActorId, Instant now) {
    if (initiatorActorId.equals(recipientActorId)) {
      return EmailHandoffOutcome.rejected(EmailHandoffOutcome.Status.SELF_TRANSFER);
    }
    final TicketRecord ticket =
        ticketRepository
            .transferOwnership(ticketId, initiatorActorId, recipientActorId, now)
            .orElseThrow(() -> new IllegalStateException("ticket owner changed under lock"));
    logger.info(
        "ticket handed off in band ticketId={} from={} to={}",
        ticketId,
        initiatorActorId,
        recipientActorId);
    return new EmailHandoffOutcome(
        EmailHandoffOutcome.Status.DELIVERED, ticket, recipientActorId, null);
  }

  private EmailHandoffOutcome deferToEmail(
      String ticketId, String initiatorActorId, String email, Instant now) {
    final TicketRecord ticket =
        ticketRepository
            .assignToEmail(ticketId, initiatorActorId, email, now)
            .orElseThrow(() -> new IllegalStateException("ticket owner changed under lock"));
    final DeferredDeliveryRecord delivery =
        new DeferredDeliveryRecord(
            UUID.randomUUID(), ticketId, email, initiatorActorId, now, null, null);
    deferredDeliveryRepository.insert(delivery);
    eventRecorder.recordDeferredDelivery(delivery);
    logger.info(
        "ticket handoff deferred ticketId={} from={} deliveryId={}",
        ticketId,
        initiatorActorId,
        delivery.deliveryId());
    return new EmailHandoffOutcome(
        EmailHandoffOutcome.Status.DEFERRED, ticket, null, delivery.deliveryId());
  }

  /** Called by the identity provider on an actor's first login with a verified email. */
  @Transactional
  public DeferredBindResult bindDeferredDeliveries(String actorId, String email) {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("email is required");
    }
    final String normalized = ActorRepository.normalizeEmail(email);
    final Instant now = Instant.now(clock);
    actorRepository.insert(actorId, normalized);
    final Optional<String> registered = actorRepository.findActorIdByEmail(normalized);
    if (registered.isEmpty() || !registered.get().equals(actorId)) {
      logger.warn(
          "deferred delivery bind rejected actorId={} registeredActorId={}",
          actorId,
          registered.orElse(null));
      return DeferredBindResult.emailMismatch(actorId);
    }
    final List<TicketRecord> tickets =
        ticketRepository.bindEmailOwnership(normalized, actorId, now);
    final int deliveries =
        deferredDeliveryRepository.bindUnbound(normalized, actorId, now).size();
    logger.info(
        "deferred deliveries bound actorId={} tickets={} deliveries={}",
        actorId,
        tickets.size(),
        deliveries);
    return DeferredBindResult.bound(actorId, tickets, deliveries);
  }
}
