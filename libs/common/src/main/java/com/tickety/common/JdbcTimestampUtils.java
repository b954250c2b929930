/*
 * Where: shared utilities
 * What: converts Instant values to java.sql.Timestamp for JDBC binding
 * Why: the PostgreSQL driver cannot always infer a SQL type for a bare Instant
 */
package com.tickety.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps them UTC regardless of the session time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
