/*
 * どこで: appointment 読み取りモデル
 * 何を: 予約サブシステムが持つ appointments への読み取り専用クエリ
 * なぜ: sweep が予約テーブルに直接依存しないようにするため
 */
package com.example.reminder.appointment;

import com.example.reminder.model.Appointment;
import java.time.Instant;
import java.util.List;

public interface AppointmentSource {

  /** {@code start <= scheduled_at < end} の CONFIRMED appointment。 */
  List<Appointment> listConfirmedAppointmentsIn(Instant start, Instant end);

  /** {@code completed_at >= since} の COMPLETED appointment。 */
  List<Appointment> listCompletedSince(Instant since);
}
