/*
 * どこで: notification チャネル契約
 * 何を: 描画済みメッセージを宛先トークンへ届ける
 * なぜ: 送信手段（push/SMTP/SMS）は外部にあり環境ごとに差し替えるため
 */
package com.example.reminder.channel;

import com.example.reminder.model.DeliveryResult;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationMessage;

public interface NotificationChannel {

  /**
   * 役割: メッセージを 1 件送信する。
   * 動作: 想定内の失敗は {@link DeliveryResult.Failed} で返す。送出された例外は呼び出し側で一時的な失敗として扱う。
   */
  DeliveryResult send(String targetRef, NotificationKind kind, NotificationMessage message);
}
