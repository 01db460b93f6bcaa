/*
 * Where: shared JDBC helpers
 * What: converts between Instant and java.sql.Timestamp in both directions
 * Why: the PostgreSQL driver cannot infer a type for a bare Instant parameter
 */
package com.zstrm.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are always UTC; Timestamp.from keeps them UTC regardless of the DB time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
