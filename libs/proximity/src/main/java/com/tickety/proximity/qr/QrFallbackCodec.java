/*
 * Where: QR fallback codec
 * What: writes and reads the versioned JSON carried in ticket QR codes
 * Why: the fallback must reject any type or version it does not know instead of guessing
 */
package com.tickety.proximity.qr;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

public class QrFallbackCodec {

  public static final String TYPE = "tickety_ticket_claim";
  public static final int VERSION = 1;
  private static final int MAX_LENGTH = 2048;

  private final ObjectMapper objectMapper;

  public QrFallbackCodec() {
    this(new ObjectMapper());
  }

  public QrFallbackCodec(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String encode(TicketReference ticket) {
    final QrPayload payload =
        new QrPayload(TYPE, VERSION, ticket.ticketId(), ticket.ticketNumber(), ticket.eventId());
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize qr payload", ex);
    }
  }

  public QrDecodeResult decode(String json) {
    if (json == null || json.isBlank()) {
      return QrDecodeResult.malformed("empty qr payload");
    }
    if (json.length() > MAX_LENGTH) {
      return QrDecodeResult.malformed("qr payload exceeds limit");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      return QrDecodeResult.malformed("qr payload is not json");
    }
    if (root == null || !root.isObject()) {
      return QrDecodeResult.malformed("qr payload is not an object");
    }
    // type and version must match exactly; anything newer is rejected.
    final JsonNode type = root.get("type");
    if (type == null || !type.isTextual() || !TYPE.equals(type.asText())) {
      return QrDecodeResult.malformed("unknown qr type");
    }
    final JsonNode version = root.get("version");
    if (version == null || !version.isInt() || version.intValue() != VERSION) {
      return QrDecodeResult.malformed("unknown qr version");
    }
    final String ticketId = text(root, "ticket_id");
    final String ticketNumber = text(root, "ticket_number");
    final String eventId = text(root, "event_id");
    if (ticketId == null || ticketNumber == null || eventId == null) {
      return QrDecodeResult.malformed("qr payload is missing fields");
    }
    return QrDecodeResult.decoded(new TicketReference(ticketId, ticketNumber, eventId));
  }

  private String text(JsonNode root, String field) {
    final JsonNode node = root.get(field);
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      return null;
    }
    return node.asText();
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record QrPayload(String type, int version, String ticketId, String ticketNumber, String eventId) {}
}
