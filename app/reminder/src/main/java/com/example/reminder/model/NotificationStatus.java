/*
 * どこで: notification ドメインモデル
 * 何を: 通知レコードの状態
 * なぜ: DB の値と遷移ルールを 1 つの enum で共有するため
 */
package com.example.reminder.model;

public enum NotificationStatus {
  PENDING,
  SENT,
  FAILED,
  PERMANENTLY_FAILED;

  public boolean isDispatchable() {
    return this == PENDING || this == FAILED;
  }
}
