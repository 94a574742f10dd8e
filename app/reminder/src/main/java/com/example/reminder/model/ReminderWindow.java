/*
 * どこで: notification ドメインモデル
 * 何を: 通知種別が対象になる半開区間 [start, end) のオフセット
 * なぜ: 24h/2h のリマインダーとレビュー依頼のウィンドウを 1 つの値型で扱うため
 */
package com.example.reminder.model;

import java.time.Duration;
import java.time.Instant;

public record ReminderWindow(Duration start, Duration end) {

  public ReminderWindow {
    if (start == null || end == null) {
      throw new IllegalArgumentException("reminder window bounds must not be null");
    }
    if (start.isNegative()) {
      throw new IllegalArgumentException("reminder window start must not be negative: " + start);
    }
    if (end.compareTo(start) <= 0) {
      throw new IllegalArgumentException(
          "reminder window end must be after start: start=" + start + " end=" + end);
    }
  }

  public boolean contains(Duration offset) {
    return offset.compareTo(start) >= 0 && offset.compareTo(end) < 0;
  }

  /** 予約前に発行する種別での scheduled_at の下限（含む）。 */
  public Instant earliestScheduledAt(Instant now) {
    return now.plus(start);
  }

  /** 予約前に発行する種別での scheduled_at の上限（含まない）。 */
  public Instant latestScheduledAt(Instant now) {
    return now.plus(end);
  }
}
