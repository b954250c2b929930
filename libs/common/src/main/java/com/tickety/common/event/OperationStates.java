/*
 * Where: shared realtime event schema
 * What: wire names of operation states and terminal reasons
 * Why: the relay writes these strings and devices switch on them
 */
package com.tickety.common.event;

import java.util.Set;

public final class OperationStates {

  public static final String PENDING = "PENDING";
  public static final String PROCESSING = "PROCESSING";
  public static final String COMPLETED = "COMPLETED";
  public static final String FAILED = "FAILED";
  public static final String CANCELLED = "CANCELLED";
  public static final String EXPIRED = "EXPIRED";

  public static final String REASON_CANCELLED_BY_INITIATOR = "cancelled_by_initiator";
  public static final String REASON_EXPIRED = "expired";
  public static final String REASON_ALREADY_REDEEMED = "already_redeemed";
  public static final String REASON_NOT_OWNER = "not_owner";

  private static final Set<String> TERMINAL = Set.of(COMPLETED, FAILED, CANCELLED, EXPIRED);

  private OperationStates() {}

  public static boolean isTerminal(String state) {
    return state != null && TERMINAL.contains(state);
  }
}
