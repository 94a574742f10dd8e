/*
 * どこで: reminder テスト補助
 * 何を: 予約サブシステムと同じ形で appointments テーブルに行を書き込む
 */
package com.example.reminder.support;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.reminder.model.Appointment;
import com.example.reminder.model.AppointmentStatus;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public final class AppointmentFixtures {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public AppointmentFixtures(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public static Appointment appointment(
      Instant scheduledAt, AppointmentStatus status, String recipientRef) {
    return new Appointment(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        scheduledAt,
        ZoneOffset.UTC,
        status,
        null,
        recipientRef);
  }

  public static Appointment completed(Instant scheduledAt, Instant completedAt, String recipientRef) {
    return new Appointment(
        UUID.randomUUID(),
        UUID.randomUUID(),
        UUID.randomUUID(),
        scheduledAt,
        ZoneId.of("Europe/Berlin"),
        AppointmentStatus.COMPLETED,
        completedAt,
        recipientRef);
  }

  public Appointment insert(Appointment appointment) {
    jdbcTemplate.update(
        """
        INSERT INTO appointments (
          appointment_id, business_id, client_id, scheduled_at, time_zone, status,
          completed_at, recipient_ref
        ) VALUES (
          :appointmentId, :businessId, :clientId, :scheduledAt, :timeZone, :status,
          :completedAt, :recipientRef
        )
        """,
        new MapSqlParameterSource()
            .addValue("appointmentId", appointment.appointmentId())
            .addValue("businessId", appointment.businessId())
            .addValue("clientId", appointment.clientId())
            .addValue("scheduledAt", toTimestamp(appointment.scheduledAt()))
            .addValue("timeZone", appointment.timeZone().getId())
            .addValue("status", appointment.status().name())
            .addValue("completedAt", toTimestamp(appointment.completedAt()))
            .addValue("recipientRef", appointment.recipientRef()));
    return appointment;
  }

  public void updateStatus(UUID appointmentId, AppointmentStatus status) {
    jdbcTemplate.update(
        "UPDATE appointments SET status = :status, updated_at = now() WHERE appointment_id = :id",
        new MapSqlParameterSource().addValue("status", status.name()).addValue("id", appointmentId));
  }

  public void deleteAll() {
    jdbcTemplate.update("DELETE FROM daily_notification_statistics", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM notification_records", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM appointments", new MapSqlParameterSource());
  }
}
