/*
 * どこで: 共通ユーティリティ
 * 何を: java.time と JDBC の日時型を明示的に変換する
 * なぜ: PostgreSQL JDBC が Instant/LocalDate の型推論に失敗するケースを回避するため
 */
package com.example.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で同じ時点のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
