package com.tickety.proximity.qr;

public record TicketReference(String ticketId, String ticketNumber, String eventId) {

  public TicketReference {
    if (isBlank(ticketId) || isBlank(ticketNumber) || isBlank(eventId)) {
      throw new IllegalArgumentException("ticketId, ticketNumber and eventId are required");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
