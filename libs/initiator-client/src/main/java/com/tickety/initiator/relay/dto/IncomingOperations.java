package com.tickety.initiator.relay.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IncomingOperations(String actorId, List<OperationSnapshot> items) {

  public IncomingOperations {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
