package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void nullValuesStayNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
    assertThat(JdbcTimestampUtils.toSqlDate(null)).isNull();
    assertThat(JdbcTimestampUtils.toLocalDate(null)).isNull();
  }

  @Test
  void conversionsKeepTheSameValue() {
    final Instant instant = Instant.parse("2026-01-17T09:30:00.123456Z");
    final LocalDate date = LocalDate.of(2026, 1, 17);

    assertThat(JdbcTimestampUtils.toInstant(JdbcTimestampUtils.toTimestamp(instant)))
        .isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toLocalDate(JdbcTimestampUtils.toSqlDate(date))).isEqualTo(date);
  }
}
