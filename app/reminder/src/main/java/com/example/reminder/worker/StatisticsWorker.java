/*
 * どこで: reminder worker
 * 何を: 1 日 1 回、前日分の統計を再集計する
 */
package com.example.reminder.worker;

import com.example.reminder.service.NotificationMetrics;
import com.example.reminder.service.StatisticsAggregationService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.statistics.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StatisticsWorker {

  private final StatisticsAggregationService statisticsAggregationService;
  private final SweepExecutionGuard guard;

  public StatisticsWorker(
      StatisticsAggregationService statisticsAggregationService, NotificationMetrics metrics) {
    this.statisticsAggregationService = statisticsAggregationService;
    this.guard = new SweepExecutionGuard("statistics", metrics);
  }

  @Scheduled(cron = "${notification.statistics.cron}", zone = "${notification.statistics.zone}")
  public void run() {
    guard.run(statisticsAggregationService::aggregatePreviousDay);
  }
}
