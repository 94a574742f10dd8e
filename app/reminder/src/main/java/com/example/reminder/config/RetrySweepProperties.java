/*
 * どこで: reminder 設定バインド
 * 何を: retry sweep の実行間隔・さかのぼり幅・ページサイズ
 */
package com.example.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.retry")
@Validated
public record RetrySweepProperties(
    boolean enabled,
    @NotNull Duration sweepInterval,
    @NotNull Duration lookback,
    @Positive int pageSize) {

  @AssertTrue(message = "notification.retry.lookback must be positive")
  public boolean isLookbackPositive() {
    return lookback != null && !lookback.isZero() && !lookback.isNegative();
  }
}
