package com.tickety.handoff.model;

// Values match the outbox_events status CHECK constraint.
public enum OutboxStatus {
  PENDING,
  IN_FLIGHT,
  PUBLISHED,
  FAILED
}
