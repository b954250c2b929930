package com.tickety.proximity.qr;

import java.util.Optional;

public record QrDecodeResult(TicketReference ticket, String malformedReason) {

  public static QrDecodeResult decoded(TicketReference ticket) {
    return new QrDecodeResult(ticket, null);
  }

  public static QrDecodeResult malformed(String reason) {
    return new QrDecodeResult(null, reason);
  }

  public boolean isMalformed() {
    return ticket == null;
  }

  public Optional<TicketReference> asTicket() {
    return Optional.ofNullable(ticket);
  }
}
