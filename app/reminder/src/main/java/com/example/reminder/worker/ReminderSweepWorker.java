/*
 * どこで: reminder worker
 * 何を: reminder sweep を固定間隔で起動する
 */
package com.example.reminder.worker;

import com.example.reminder.service.NotificationMetrics;
import com.example.reminder.service.ReminderSweepService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.reminder.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReminderSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReminderSweepWorker.class);

  private final ReminderSweepService reminderSweepService;
  private final SweepExecutionGuard guard;

  public ReminderSweepWorker(ReminderSweepService reminderSweepService, NotificationMetrics metrics) {
    this.reminderSweepService = reminderSweepService;
    this.guard = new SweepExecutionGuard("reminder", metrics);
  }

  @Scheduled(fixedDelayString = "${notification.reminder.sweep-interval}")
  public void run() {
    guard
        .run(reminderSweepService::runSweep)
        .ifPresent(summary -> logger.info("reminder sweep finished summary={}", summary));
  }
}
