/*
 * どこで: notification ドメインモデル
 * 何を: 通知種別の閉じた集合と、その基準時刻・既定の対象ウィンドウ
 * なぜ: sweep がリマインダー種別を決め打ちせず基準時刻で種別を列挙するため
 */
package com.example.reminder.model;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum NotificationKind {
  BOOKING_CONFIRMATION(Anchor.TRANSITION, null),
  REMINDER_24H(
      Anchor.BEFORE_SCHEDULED, new ReminderWindow(Duration.ofHours(24), Duration.ofHours(25))),
  REMINDER_2H(
      Anchor.BEFORE_SCHEDULED, new ReminderWindow(Duration.ofHours(2), Duration.ofMinutes(150))),
  REVIEW_REQUEST(Anchor.AFTER_COMPLETION, new ReminderWindow(Duration.ZERO, Duration.ofHours(24))),
  CANCELLATION(Anchor.TRANSITION, null);

  public enum Anchor {
    /** appointment の状態変化時に lifecycle トリガーが発行する。 */
    TRANSITION,
    /** scheduled_at を基準に reminder sweep が発行する。 */
    BEFORE_SCHEDULED,
    /** completed_at を基準に review request sweep が発行する。 */
    AFTER_COMPLETION
  }

  private final Anchor anchor;
  private final ReminderWindow defaultWindow;

  NotificationKind(Anchor anchor, ReminderWindow defaultWindow) {
    this.anchor = anchor;
    this.defaultWindow = defaultWindow;
  }

  public Anchor anchor() {
    return anchor;
  }

  public Optional<ReminderWindow> defaultWindow() {
    return Optional.ofNullable(defaultWindow);
  }

  public static List<NotificationKind> anchoredTo(Anchor anchor) {
    return Arrays.stream(values()).filter(kind -> kind.anchor == anchor).toList();
  }
}
