/*
 * Where: handoff domain model
 * What: lifecycle of a transfer token
 * Why: a token leaves ACTIVE at most once and is never accepted again afterwards
 */
package com.tickety.handoff.model;

public enum TokenStatus {
  ACTIVE,
  REDEEMED,
  EXPIRED,
  REVOKED
}
