package com.tickety.handoff.service;

import com.tickety.handoff.model.OperationState;
import java.util.UUID;

/** Published when an operation reaches a terminal state. */
public record OperationClosedEvent(UUID operationId, OperationState state) {}
