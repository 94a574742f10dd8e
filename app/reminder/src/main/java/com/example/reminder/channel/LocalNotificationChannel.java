/*
 * どこで: notification チャネル実装
 * 何を: 外部送信の代わりにログへ出力するチャネル
 * なぜ: 外部の認証情報なしでローカルでも状態遷移を一通り動かすため
 */
package com.example.reminder.channel;

import com.example.reminder.model.DeliveryResult;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalNotificationChannel implements NotificationChannel {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationChannel.class);

  @Override
  public DeliveryResult send(String targetRef, NotificationKind kind, NotificationMessage message) {
    if (targetRef == null || targetRef.isBlank()) {
      return DeliveryResult.permanentFailure("recipient token is empty");
    }
    logger.info(
        "notification simulated send kind={} target={} title={}", kind, targetRef, message.title());
    return DeliveryResult.delivered();
  }
}
