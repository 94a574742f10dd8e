/*
 * どこで: reminder worker
 * 何を: retry sweep を固定間隔で起動する
 */
package com.example.reminder.worker;

import com.example.reminder.service.NotificationMetrics;
import com.example.reminder.service.RetrySweepService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.retry.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RetrySweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(RetrySweepWorker.class);

  private final RetrySweepService retrySweepService;
  private final SweepExecutionGuard guard;

  public RetrySweepWorker(RetrySweepService retrySweepService, NotificationMetrics metrics) {
    this.retrySweepService = retrySweepService;
    this.guard = new SweepExecutionGuard("retry", metrics);
  }

  @Scheduled(fixedDelayString = "${notification.retry.sweep-interval}")
  public void run() {
    guard
        .run(retrySweepService::runSweep)
        .ifPresent(summary -> logger.info("retry sweep finished summary={}", summary));
  }
}
