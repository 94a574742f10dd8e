/*
 * どこで: notification ログのデータアクセス
 * 何を: (created_at, notification_id) のキーセット位置
 */
package com.example.reminder.repository;

import com.example.reminder.model.NotificationRecord;
import java.time.Instant;
import java.util.UUID;

public record PageCursor(Instant createdAt, UUID notificationId) {

  public static final PageCursor START = new PageCursor(Instant.EPOCH, new UUID(0L, 0L));

  public static PageCursor after(NotificationRecord record) {
    return new PageCursor(record.createdAt(), record.notificationId());
  }
}
