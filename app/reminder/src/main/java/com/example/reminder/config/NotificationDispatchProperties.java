/*
 * どこで: reminder 設定バインド
 * 何を: チャネルタイムアウト、リトライ上限、送信リース、Executor サイズ
 * なぜ: 全 sweep と lifecycle トリガーで同じ送信方針を共有するため
 */
package com.example.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.dispatch")
@Validated
public record NotificationDispatchProperties(
    @NotNull Duration channelTimeout,
    @Positive int maxRetries,
    @NotNull Duration lease,
    @Positive int errorMessageMaxLength,
    @Positive int channelPoolSize,
    @Positive int lifecyclePoolSize,
    @PositiveOrZero int lifecycleQueueCapacity) {

  @AssertTrue(message = "notification.dispatch.channel-timeout must be positive")
  public boolean isChannelTimeoutPositive() {
    return channelTimeout != null && !channelTimeout.isZero() && !channelTimeout.isNegative();
  }

  @AssertTrue(message = "notification.dispatch.lease must be longer than channel-timeout")
  public boolean isLeaseLongerThanChannelTimeout() {
    // 送信中にリースが切れると、滞留 PENDING の回収で二重送信になる
    if (lease == null || channelTimeout == null) {
      return false;
    }
    return lease.compareTo(channelTimeout) > 0;
  }
}
