/*
 * どこで: reminder 設定バインドのテスト
 * 何を: 起動時の Duration・ウィンドウ map のバインドと項目間チェックを検証する
 */
package com.example.reminder.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.ReminderWindow;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class NotificationPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "notification.dispatch.channel-timeout=5s",
              "notification.dispatch.max-retries=3",
              "notification.dispatch.lease=2m",
              "notification.dispatch.error-message-max-length=1000",
              "notification.dispatch.channel-pool-size=16",
              "notification.dispatch.lifecycle-pool-size=4",
              "notification.dispatch.lifecycle-queue-capacity=200",
              "notification.reminder.enabled=true",
              "notification.reminder.sweep-interval=5m",
              "notification.reminder.windows[REMINDER_2H].start=2h",
              "notification.reminder.windows[REMINDER_2H].end=3h",
              "notification.retry.enabled=true",
              "notification.retry.sweep-interval=1h",
              "notification.retry.lookback=24h",
              "notification.retry.page-size=100",
              "notification.retention.enabled=true",
              "notification.retention.sent-retention-days=90",
              "notification.retention.failed-retention-days=30",
              "notification.retention.stale-pending-after=24h",
              "notification.retention.cron=0 0 2 * * *");

  @Test
  void bindsDurationsAndWindowOverrides() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final NotificationDispatchProperties dispatch =
              context.getBean(NotificationDispatchProperties.class);
          final ReminderSweepProperties reminder = context.getBean(ReminderSweepProperties.class);
          final RetrySweepProperties retry = context.getBean(RetrySweepProperties.class);
          final NotificationRetentionProperties retention =
              context.getBean(NotificationRetentionProperties.class);

          assertThat(dispatch.lease()).isEqualTo(Duration.ofMinutes(2));
          assertThat(reminder.windowFor(NotificationKind.REMINDER_2H))
              .isEqualTo(new ReminderWindow(Duration.ofHours(2), Duration.ofHours(3)));
          assertThat(reminder.windowFor(NotificationKind.REMINDER_24H))
              .isEqualTo(new ReminderWindow(Duration.ofHours(24), Duration.ofHours(25)));
          assertThat(retry.lookback()).isEqualTo(Duration.ofHours(24));
          assertThat(retention.stalePendingAfter()).isEqualTo(Duration.ofHours(24));
        });
  }

  @Test
  void rejectsLeaseShorterThanChannelTimeout() {
    contextRunner
        .withPropertyValues("notification.dispatch.lease=3s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsInvertedWindow() {
    contextRunner
        .withPropertyValues(
            "notification.reminder.windows[REMINDER_24H].start=25h",
            "notification.reminder.windows[REMINDER_24H].end=24h")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsWindowForTransitionKind() {
    contextRunner
        .withPropertyValues(
            "notification.reminder.windows[CANCELLATION].start=0s",
            "notification.reminder.windows[CANCELLATION].end=1h")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    NotificationDispatchProperties.class,
    ReminderSweepProperties.class,
    RetrySweepProperties.class,
    NotificationRetentionProperties.class
  })
  static class TestConfiguration {}
}
