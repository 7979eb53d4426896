/*
 * Where: common JDBC helpers
 * What: binds Instant values as java.sql.Timestamp
 * Why: the PostgreSQL driver cannot infer a SQL type for Instant when bound through setObject
 */
package com.newsletter.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; timestamptz columns keep it as-is regardless of the session time zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
