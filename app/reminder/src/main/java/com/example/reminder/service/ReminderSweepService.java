/*
 * どこで: reminder サービス層
 * 何を: scheduled_at 前を基準とする全種別に対する reminder sweep の 1 回分
 * なぜ: リマインダーはイベントではなく時刻から決まるため、走査で見つける
 */
package com.example.reminder.service;

import com.example.reminder.appointment.AppointmentSource;
import com.example.reminder.config.ReminderSweepProperties;
import com.example.reminder.model.Appointment;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.ReminderWindow;
import com.example.reminder.model.SweepSummary;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderSweepService {

  private static final Logger logger = LoggerFactory.getLogger(ReminderSweepService.class);

  private final AppointmentSource appointmentSource;
  private final NotificationIssuer issuer;
  private final ReminderSweepProperties properties;
  private final Clock clock;

  public SweepSummary runSweep() {
    final Instant now = Instant.now(clock);
    final SweepSummary.Tally tally = SweepSummary.tally();
    for (NotificationKind kind :
        NotificationKind.anchoredTo(NotificationKind.Anchor.BEFORE_SCHEDULED)) {
      final ReminderWindow window = properties.windowFor(kind);
      final Instant start = window.earliestScheduledAt(now);
      final Instant end = window.latestScheduledAt(now);
      final List<Appointment> due = appointmentSource.listConfirmedAppointmentsIn(start, end);
      logger.debug(
          "reminder window kind={} start={} end={} appointments={}", kind, start, end, due.size());
      for (Appointment appointment : due) {
        issuer.issue(appointment, kind, now, tally);
      }
    }
    return tally.toSummary();
  }
}
