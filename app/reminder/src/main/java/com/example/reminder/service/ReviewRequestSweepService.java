/*
 * どこで: reminder サービス層
 * 何を: 直近に完了した appointment の利用者へレビュー依頼を送る日次 sweep
 */
package com.example.reminder.service;

import com.example.reminder.appointment.AppointmentSource;
import com.example.reminder.config.ReminderSweepProperties;
import com.example.reminder.config.ReviewRequestSweepProperties;
import com.example.reminder.model.Appointment;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.ReminderWindow;
import com.example.reminder.model.SweepSummary;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReviewRequestSweepService {

  private final AppointmentSource appointmentSource;
  private final NotificationIssuer issuer;
  private final ReminderSweepProperties properties;
  private final ReviewRequestSweepProperties reviewProperties;
  private final Clock clock;

  public SweepSummary runSweep() {
    final Instant now = Instant.now(clock);
    // 遅延・欠落した日次実行の分は次回で拾い、重複抑止で依頼は 1 件に保つ
    final ReminderWindow window =
        widen(
            properties.windowFor(NotificationKind.REVIEW_REQUEST),
            reviewProperties.missedRunGrace());
    final SweepSummary.Tally tally = SweepSummary.tally();
    for (Appointment appointment : appointmentSource.listCompletedSince(now.minus(window.end()))) {
      if (appointment.completedAt() == null
          || !window.contains(Duration.between(appointment.completedAt(), now))) {
        tally.skipped();
        continue;
      }
      issuer.issue(appointment, NotificationKind.REVIEW_REQUEST, now, tally);
    }
    return tally.toSummary();
  }

  private static ReminderWindow widen(ReminderWindow window, Duration grace) {
    return new ReminderWindow(window.start(), window.end().plus(grace));
  }
}
