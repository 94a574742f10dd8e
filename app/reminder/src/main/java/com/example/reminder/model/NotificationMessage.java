/*
 * どこで: notification ドメインモデル
 * 何を: チャネルへ渡す描画済みメッセージ（title・body・フラットな data map）
 * なぜ: payload_json に保存し、リトライで作成時の描画内容をそのまま再送するため
 */
package com.example.reminder.model;

import java.util.Map;

public record NotificationMessage(String title, String body, Map<String, String> data) {

  public NotificationMessage {
    data = data == null ? Map.of() : Map.copyOf(data);
  }
}
