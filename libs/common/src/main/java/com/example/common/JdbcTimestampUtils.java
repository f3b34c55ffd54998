/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と JDBC Timestamp を相互変換する
 * なぜ: PostgreSQL JDBC の型推論に頼らず timestamptz を UTC で扱うため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  // NULL 列は null のまま返す
  public static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
    final Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toInstant();
  }
}
