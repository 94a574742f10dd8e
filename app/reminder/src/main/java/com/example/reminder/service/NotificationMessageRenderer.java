/*
 * どこで: reminder サービス層
 * 何を: 通知種別ごとに title・body・data map を描画する
 * なぜ: 描画したメッセージを作成時点で payload_json に固定するため
 */
package com.example.reminder.service;

import com.example.reminder.model.Appointment;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationMessage;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class NotificationMessageRenderer {

  static final String REVIEW_CLICK_ACTION = "REVIEW_SCREEN";

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("MMMM d, yyyy 'at' h:mm a", Locale.ENGLISH);
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

  public NotificationMessage render(Appointment appointment, NotificationKind kind) {
    final String when = DATE_TIME.format(appointment.scheduledAt().atZone(appointment.timeZone()));
    final Map<String, String> data = new LinkedHashMap<>();
    data.put("type", kind.name().toLowerCase(Locale.ROOT));
    data.put("appointment_id", appointment.appointmentId().toString());
    data.put("business_id", appointment.businessId().toString());
    return switch (kind) {
      case BOOKING_CONFIRMATION ->
          new NotificationMessage(
              "Appointment Confirmed",
              "Your appointment on " + when + " has been confirmed.",
              data);
      case REMINDER_24H ->
          new NotificationMessage(
              "Appointment Reminder - 24 hours",
              "You have an appointment in 24 hours, on " + when + ".",
              data);
      case REMINDER_2H ->
          new NotificationMessage(
              "Appointment Reminder - 2 hours",
              "You have an appointment in 2 hours, on " + when + ".",
              data);
      case REVIEW_REQUEST -> {
        data.put("click_action", REVIEW_CLICK_ACTION);
        final String day = DATE.format(appointment.scheduledAt().atZone(appointment.timeZone()));
        yield new NotificationMessage(
            "How was your experience?",
            "Thank you for your visit on " + day + ". Tap here to leave a review.",
            data);
      }
      case CANCELLATION ->
          new NotificationMessage(
              "Appointment Cancelled",
              "Your appointment on " + when + " has been cancelled.",
              data);
    };
  }
}
