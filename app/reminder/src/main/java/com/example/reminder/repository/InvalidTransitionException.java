/*
 * どこで: notification ログのデータアクセス
 * 何を: 状態更新時に対象が存在しないか終端状態だった場合に送出する
 * なぜ: 不正な遷移を黙って無視せず呼び出し元に知らせるため
 */
package com.example.reminder.repository;

import com.example.reminder.model.NotificationStatus;
import java.util.Optional;
import java.util.UUID;

public class InvalidTransitionException extends RuntimeException {

  private final UUID notificationId;
  private final NotificationStatus currentStatus;
  private final NotificationStatus targetStatus;

  public InvalidTransitionException(
      UUID notificationId, NotificationStatus currentStatus, NotificationStatus targetStatus) {
    super(
        "invalid notification transition id="
            + notificationId
            + " from="
            + (currentStatus == null ? "missing" : currentStatus.name())
            + " to="
            + targetStatus);
    this.notificationId = notificationId;
    this.currentStatus = currentStatus;
    this.targetStatus = targetStatus;
  }

  public UUID notificationId() {
    return notificationId;
  }

  /** レコードが存在しない場合は空。 */
  public Optional<NotificationStatus> currentStatus() {
    return Optional.ofNullable(currentStatus);
  }

  public NotificationStatus targetStatus() {
    return targetStatus;
  }
}
