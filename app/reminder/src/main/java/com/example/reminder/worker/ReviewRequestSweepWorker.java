/*
 * どこで: reminder worker
 * 何を: review request sweep を日次の実行枠で起動する
 */
package com.example.reminder.worker;

import com.example.reminder.service.NotificationMetrics;
import com.example.reminder.service.ReviewRequestSweepService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.review.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReviewRequestSweepWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReviewRequestSweepWorker.class);

  private final ReviewRequestSweepService reviewRequestSweepService;
  private final SweepExecutionGuard guard;

  public ReviewRequestSweepWorker(
      ReviewRequestSweepService reviewRequestSweepService, NotificationMetrics metrics) {
    this.reviewRequestSweepService = reviewRequestSweepService;
    this.guard = new SweepExecutionGuard("review_request", metrics);
  }

  @Scheduled(cron = "${notification.review.cron}", zone = "${notification.review.zone}")
  public void run() {
    guard
        .run(reviewRequestSweepService::runSweep)
        .ifPresent(summary -> logger.info("review request sweep finished summary={}", summary));
  }
}
