/*
 * どこで: appointment ビューモデル
 * 何を: 予約サブシステムが通知する状態遷移（遷移後の appointment を保持）
 */
package com.example.reminder.model;

import java.time.Instant;

public record AppointmentTransition(
    Appointment appointment, AppointmentStatus previousStatus, Instant occurredAt) {

  public AppointmentStatus newStatus() {
    return appointment.status();
  }
}
