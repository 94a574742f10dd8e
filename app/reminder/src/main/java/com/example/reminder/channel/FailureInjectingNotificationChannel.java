/*
 * どこで: notification チャネル実装
 * 何を: 指定プレフィックスの宛先で失敗する CI/テスト専用チャネル
 * なぜ: E2E テストで実コードのままリトライと PERMANENTLY_FAILED の経路を通すため
 */
package com.example.reminder.channel;

import com.example.reminder.model.DeliveryResult;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.dispatch.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingNotificationChannel implements NotificationChannel {

  private final LocalNotificationChannel delegate;

  @Value("${notification.dispatch.failure-injection.recipient-prefix:}")
  private String recipientPrefix;

  @Value("${notification.dispatch.failure-injection.permanent-prefix:}")
  private String permanentPrefix;

  @Override
  public DeliveryResult send(String targetRef, NotificationKind kind, NotificationMessage message) {
    if (matches(permanentPrefix, targetRef)) {
      return DeliveryResult.permanentFailure("failure injection rejected recipient " + targetRef);
    }
    if (matches(recipientPrefix, targetRef)) {
      throw new IllegalStateException(
          "notification channel failure injection matched recipient=" + targetRef);
    }
    return delegate.send(targetRef, kind, message);
  }

  private boolean matches(String prefix, String targetRef) {
    if (prefix == null || prefix.isBlank() || targetRef == null) {
      return false;
    }
    return targetRef.startsWith(prefix);
  }
}
