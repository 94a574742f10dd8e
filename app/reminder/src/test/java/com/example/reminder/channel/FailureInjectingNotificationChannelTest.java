/*
 * どこで: notification チャネルの単体テスト
 * 何を: CI/テスト用失敗注入チャネルのプレフィックス分岐を検証する
 */
package com.example.reminder.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.reminder.model.DeliveryResult;
import com.example.reminder.model.FailureReason;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationMessage;
import java.lang.reflect.Field;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FailureInjectingNotificationChannelTest {

  private static final NotificationMessage MESSAGE =
      new NotificationMessage("title", "body", Map.of());

  @Test
  void throwsWhenRecipientPrefixMatches() {
    final LocalNotificationChannel delegate = mock(LocalNotificationChannel.class);
    final FailureInjectingNotificationChannel channel = channel(delegate, "fail-", "invalid-");

    assertThatThrownBy(() -> channel.send("fail-1", NotificationKind.REMINDER_2H, MESSAGE))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failure injection");
    verifyNoInteractions(delegate);
  }

  @Test
  void returnsPermanentFailureWhenPermanentPrefixMatches() {
    final LocalNotificationChannel delegate = mock(LocalNotificationChannel.class);
    final FailureInjectingNotificationChannel channel = channel(delegate, "fail-", "invalid-");

    final DeliveryResult result = channel.send("invalid-1", NotificationKind.REMINDER_2H, MESSAGE);

    assertThat(result).isInstanceOf(DeliveryResult.Failed.class);
    assertThat(((DeliveryResult.Failed) result).reason()).isEqualTo(FailureReason.PERMANENT);
    verifyNoInteractions(delegate);
  }

  @Test
  void delegatesWhenNoPrefixMatches() {
    final LocalNotificationChannel delegate = mock(LocalNotificationChannel.class);
    when(delegate.send("token-1", NotificationKind.REMINDER_2H, MESSAGE))
        .thenReturn(DeliveryResult.delivered());
    final FailureInjectingNotificationChannel channel = channel(delegate, "fail-", "invalid-");

    assertThat(channel.send("token-1", NotificationKind.REMINDER_2H, MESSAGE))
        .isEqualTo(DeliveryResult.delivered());
    verify(delegate).send("token-1", NotificationKind.REMINDER_2H, MESSAGE);
  }

  @Test
  void blankPrefixesNeverMatch() {
    final LocalNotificationChannel delegate = mock(LocalNotificationChannel.class);
    when(delegate.send("fail-1", NotificationKind.CANCELLATION, MESSAGE))
        .thenReturn(DeliveryResult.delivered());
    final FailureInjectingNotificationChannel channel = channel(delegate, "", " ");

    assertThat(channel.send("fail-1", NotificationKind.CANCELLATION, MESSAGE))
        .isEqualTo(DeliveryResult.delivered());
  }

  private static FailureInjectingNotificationChannel channel(
      LocalNotificationChannel delegate, String recipientPrefix, String permanentPrefix) {
    final FailureInjectingNotificationChannel channel =
        new FailureInjectingNotificationChannel(delegate);
    setField(channel, "recipientPrefix", recipientPrefix);
    setField(channel, "permanentPrefix", permanentPrefix);
    return channel;
  }

  private static void setField(Object target, String name, String value) {
    try {
      final Field field = target.getClass().getDeclaredField(name);
      field.setAccessible(true);
      field.set(target, value);
    } catch (ReflectiveOperationException ex) {
      throw new IllegalStateException(ex);
    }
  }
}
