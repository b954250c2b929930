package com.tickety.handoff.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tickety.handoff.service.DeferredBindResult;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BindDeferredResponse(String actorId, List<TicketView> tickets, int deliveries) {

  public BindDeferredResponse {
    tickets = List.copyOf(tickets);
  }

  static BindDeferredResponse from(DeferredBindResult result) {
    return new BindDeferredResponse(
        result.actorId(),
        result.tickets().stream().map(TicketView::from).toList(),
        result.deliveries());
  }
}
