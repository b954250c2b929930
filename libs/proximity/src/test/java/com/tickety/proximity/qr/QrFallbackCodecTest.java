package com.tickety.proximity.qr;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QrFallbackCodecTest {

  private final QrFallbackCodec codec = new QrFallbackCodec();

  @Test
  void encodesStableSnakeCaseSchema() {
    final String json = codec.encode(new TicketReference("t-1", "TKT-0001", "e-1"));

    assertThat(json)
        .isEqualTo(
            "{\"type\":\"tickety_ticket_claim\",\"version\":1,\"ticket_id\":\"t-1\","
                + "\"ticket_number\":\"TKT-0001\",\"event_id\":\"e-1\"}");
  }

  @Test
  void decodesWhatItEncodes() {
    final TicketReference ticket = new TicketReference("t-1", "TKT-0001", "e-1");

    assertThat(codec.decode(codec.encode(ticket)).ticket()).isEqualTo(ticket);
  }

  @Test
  void rejectsUnknownType() {
    final QrDecodeResult result =
        codec.decode(
            "{\"type\":\"ticket\",\"version\":1,\"ticket_id\":\"t\",\"ticket_number\":\"n\","
                + "\"event_id\":\"e\"}");

    assertThat(result.isMalformed()).isTrue();
    assertThat(result.malformedReason()).isEqualTo("unknown qr type");
  }

  @Test
  void rejectsUnknownVersion() {
    final QrDecodeResult result =
        codec.decode(
            "{\"type\":\"tickety_ticket_claim\",\"version\":2,\"ticket_id\":\"t\","
                + "\"ticket_number\":\"n\",\"event_id\":\"e\"}");

    assertThat(result.malformedReason()).isEqualTo("unknown qr version");
  }

  @Test
  void rejectsVersionGivenAsString() {
    final QrDecodeResult result =
        codec.decode(
            "{\"type\":\"tickety_ticket_claim\",\"version\":\"1\",\"ticket_id\":\"t\","
                + "\"ticket_number\":\"n\",\"event_id\":\"e\"}");

    assertThat(result.isMalformed()).isTrue();
  }

  @Test
  void rejectsMissingFieldsAndNonJson() {
    assertThat(
            codec
                .decode("{\"type\":\"tickety_ticket_claim\",\"version\":1,\"ticket_id\":\"t\"}")
                .malformedReason())
        .isEqualTo("qr payload is missing fields");
    assertThat(codec.decode("TKT-0001").isMalformed()).isTrue();
    assertThat(codec.decode("[1,2]").isMalformed()).isTrue();
    assertThat(codec.decode("").isMalformed()).isTrue();
    assertThat(codec.decode(null).isMalformed()).isTrue();
  }
}
