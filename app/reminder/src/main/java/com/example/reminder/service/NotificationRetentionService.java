/*
 * どこで: reminder サービス層
 * 何を: 終端状態の通知を保持期間で削除し、滞留した PENDING を報告する
 * なぜ: 無制限な増加を防ぎつつ、異常な PENDING は調査用に残すため
 */
package com.example.reminder.service;

import com.example.reminder.config.NotificationRetentionProperties;
import com.example.reminder.model.NotificationStatus;
import com.example.reminder.repository.NotificationLogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationLogRepository notificationLogRepository;
  private final NotificationRetentionProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant staleThreshold = now.minus(properties.stalePendingAfter());
    final int stalePending = notificationLogRepository.countStalePending(staleThreshold);
    metrics.updateStalePending(stalePending);
    if (stalePending > 0) {
      logger.error(
          "notification retention found stale pending records count={} threshold={}",
          stalePending,
          staleThreshold);
    }
    final Instant sentThreshold = now.minus(Duration.ofDays(properties.sentRetentionDays()));
    final Instant failedThreshold = now.minus(Duration.ofDays(properties.failedRetentionDays()));
    final int deletedSent =
        notificationLogRepository.deleteOlderThan(
            EnumSet.of(NotificationStatus.SENT), sentThreshold);
    final int deletedFailed =
        notificationLogRepository.deleteOlderThan(
            EnumSet.of(NotificationStatus.FAILED, NotificationStatus.PERMANENTLY_FAILED),
            failedThreshold);
    logger.info(
        "notification retention cleanup deleted sent={} failed={} sentThreshold={} failedThreshold={}",
        deletedSent,
        deletedFailed,
        sentThreshold,
        failedThreshold);
  }
}
