/*
 * どこで: reminder API モデル
 * 何を: 1 件の appointment に記録された全通知
 */
package com.example.reminder.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppointmentNotificationsResponse(
    UUID appointmentId, List<NotificationView> notifications) {

  public AppointmentNotificationsResponse {
    // SpotBugs EI_EXPOSE_REP 対策: 不変コピーを保持する
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
