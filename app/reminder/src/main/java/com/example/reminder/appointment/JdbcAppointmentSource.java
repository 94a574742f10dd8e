/*
 * どこで: appointment 読み取りモデル
 * 何を: 共有の appointments テーブルを読む AppointmentSource 実装
 */
package com.example.reminder.appointment;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.reminder.model.Appointment;
import com.example.reminder.model.AppointmentStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JdbcAppointmentSource implements AppointmentSource {

  private static final Logger logger = LoggerFactory.getLogger(JdbcAppointmentSource.class);

  private static final String COLUMNS =
      """
      appointment_id, business_id, client_id, scheduled_at, time_zone, status,
      completed_at, recipient_ref
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<Appointment> listConfirmedAppointmentsIn(Instant start, Instant end) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM appointments
            WHERE status = 'CONFIRMED'
              AND scheduled_at >= :start
              AND scheduled_at < :end
            ORDER BY scheduled_at, appointment_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("start", toTimestamp(start))
            .addValue("end", toTimestamp(end));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<Appointment> listCompletedSince(Instant since) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM appointments
            WHERE status = 'COMPLETED'
              AND completed_at >= :since
            ORDER BY completed_at, appointment_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private Appointment mapRow(ResultSet rs, int rowNum) throws SQLException {
    final UUID appointmentId = rs.getObject("appointment_id", UUID.class);
    return new Appointment(
        appointmentId,
        rs.getObject("business_id", UUID.class),
        rs.getObject("client_id", UUID.class),
        toInstant(rs.getTimestamp("scheduled_at")),
        resolveZone(appointmentId, rs.getString("time_zone")),
        AppointmentStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("completed_at")),
        rs.getString("recipient_ref"));
  }

  private ZoneId resolveZone(UUID appointmentId, String zone) {
    if (zone == null || zone.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException ex) {
      // メッセージは UTC で描画する
      logger.warn("appointment has unknown time zone id={} zone={}", appointmentId, zone, ex);
      return ZoneOffset.UTC;
    }
  }
}
