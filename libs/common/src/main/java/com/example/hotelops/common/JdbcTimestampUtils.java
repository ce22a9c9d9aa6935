/*
 * Where: shared JDBC helpers
 * What: Converts between Instant and java.sql.Timestamp in both directions
 * Why: PostgreSQL JDBC cannot infer a SQL type for Instant bind values, and nullable
 *      timestamp columns need the same null handling in every row mapper
 */
package com.example.hotelops.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is always UTC; Timestamp.from keeps it that way regardless of the DB session zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
