/*
 * どこで: reminder worker
 * 何を: 保持期間による削除を定期実行する
 * なぜ: 手動作業なしで削除を自動化するため
 */
package com.example.reminder.worker;

import com.example.reminder.service.NotificationMetrics;
import com.example.reminder.service.NotificationRetentionService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.retention.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationRetentionWorker {

  private final NotificationRetentionService retentionService;
  private final SweepExecutionGuard guard;

  public NotificationRetentionWorker(
      NotificationRetentionService retentionService, NotificationMetrics metrics) {
    this.retentionService = retentionService;
    this.guard = new SweepExecutionGuard("retention", metrics);
  }

  @Scheduled(cron = "${notification.retention.cron}")
  public void run() {
    guard.run(
        () -> {
          retentionService.cleanup();
          return Boolean.TRUE;
        });
  }
}
