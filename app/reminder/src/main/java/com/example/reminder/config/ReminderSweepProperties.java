/*
 * どこで: reminder 設定バインド
 * 何を: reminder sweep の実行間隔と通知種別ごとの対象ウィンドウ
 * なぜ: ウィンドウを環境ごとに調整でき、未設定の種別は既定値を使うため
 */
package com.example.reminder.config;

import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.ReminderWindow;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.reminder")
@Validated
public record ReminderSweepProperties(
    boolean enabled, @NotNull Duration sweepInterval, Map<NotificationKind, ReminderWindow> windows) {

  public ReminderSweepProperties {
    final Map<NotificationKind, ReminderWindow> copy = new EnumMap<>(NotificationKind.class);
    if (windows != null) {
      copy.putAll(windows);
    }
    windows = Collections.unmodifiableMap(copy);
  }

  public ReminderWindow windowFor(NotificationKind kind) {
    final ReminderWindow configured = windows.get(kind);
    if (configured != null) {
      return configured;
    }
    return kind.defaultWindow()
        .orElseThrow(
            () -> new IllegalArgumentException("notification kind has no window: " + kind));
  }

  @AssertTrue(message = "notification.reminder.windows may only configure windowed kinds")
  public boolean isWindowsOnlyForWindowedKinds() {
    return windows.keySet().stream().allMatch(kind -> kind.defaultWindow().isPresent());
  }

  @AssertTrue(
      message = "notification.reminder.sweep-interval must not exceed any reminder window width")
  public boolean isSweepIntervalWithinWindows() {
    // 実行間隔がウィンドウ幅を超えると、リマインダーを送れない予約が出る
    if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
      return false;
    }
    return NotificationKind.anchoredTo(NotificationKind.Anchor.BEFORE_SCHEDULED).stream()
        .map(this::windowFor)
        .allMatch(window -> window.end().minus(window.start()).compareTo(sweepInterval) >= 0);
  }
}
