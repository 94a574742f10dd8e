/*
 * どこで: 統計のデータアクセス
 * 何を: daily_notification_statistics の再集計と読み出し
 */
package com.example.reminder.repository;

import static com.example.common.JdbcTimestampUtils.toLocalDate;
import static com.example.common.JdbcTimestampUtils.toSqlDate;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.reminder.model.DailyStatistic;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DailyStatisticsRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int deleteForDate(LocalDate statDate) {
    final String sql = "DELETE FROM daily_notification_statistics WHERE stat_date = :statDate";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("statDate", toSqlDate(statDate)));
  }

  /**
   * 役割: [from, to) に作成された notification_records を (kind, status) ごとに数え、{@code statDate} に保存する。
   * 動作: 同じキーの既存行は上書きする。
   */
  public int aggregate(LocalDate statDate, Instant from, Instant to, Instant aggregatedAt) {
    final String sql =
        """
        INSERT INTO daily_notification_statistics (
          stat_date, kind, status, record_count, aggregated_at
        )
        SELECT CAST(:statDate AS DATE), kind, status, COUNT(*), :aggregatedAt
        FROM notification_records
        WHERE created_at >= :from
          AND created_at < :to
        GROUP BY kind, status
        ON CONFLICT (stat_date, kind, status) DO UPDATE
        SET record_count = EXCLUDED.record_count,
            aggregated_at = EXCLUDED.aggregated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("statDate", toSqlDate(statDate))
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to))
            .addValue("aggregatedAt", toTimestamp(aggregatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public List<DailyStatistic> findBetween(LocalDate fromInclusive, LocalDate toInclusive) {
    final String sql =
        """
        SELECT stat_date, kind, status, record_count
        FROM daily_notification_statistics
        WHERE stat_date BETWEEN :from AND :to
        ORDER BY stat_date, kind, status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toSqlDate(fromInclusive))
            .addValue("to", toSqlDate(toInclusive));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private DailyStatistic mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DailyStatistic(
        toLocalDate(rs.getDate("stat_date")),
        NotificationKind.valueOf(rs.getString("kind")),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getLong("record_count"));
  }
}
