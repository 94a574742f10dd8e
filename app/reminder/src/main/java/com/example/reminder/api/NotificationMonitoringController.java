/*
 * どこで: reminder API
 * 何を: 通知ログと日次統計に対する読み取り専用クエリ
 * なぜ: 運用者が DB に触れずに送信状況を確認するため
 */
package com.example.reminder.api;

import com.example.reminder.model.DailyStatistic;
import com.example.reminder.model.NotificationRecord;
import com.example.reminder.model.NotificationStatus;
import com.example.reminder.repository.DailyStatisticsRepository;
import com.example.reminder.repository.NotificationLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationMonitoringController {

  static final long MAX_STATISTICS_RANGE_DAYS = 366;
  static final int MAX_COUNT_DAYS = 365;

  private final NotificationLogRepository notificationLogRepository;
  private final DailyStatisticsRepository dailyStatisticsRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @GetMapping("/appointments/{appointmentId}")
  public AppointmentNotificationsResponse byAppointment(
      @PathVariable("appointmentId") UUID appointmentId) {
    final List<NotificationView> notifications =
        notificationLogRepository.findByAppointmentId(appointmentId).stream()
            .map(this::toView)
            .toList();
    return new AppointmentNotificationsResponse(appointmentId, notifications);
  }

  @GetMapping("/statistics")
  public DailyStatisticsResponse statistics(
      @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    if (from.isAfter(to)) {
      throw new InvalidRequestException("from must not be after to");
    }
    if (ChronoUnit.DAYS.between(from, to) + 1 > MAX_STATISTICS_RANGE_DAYS) {
      throw new InvalidRequestException(
          "date range must not exceed " + MAX_STATISTICS_RANGE_DAYS + " days");
    }
    final List<DailyStatisticView> statistics =
        dailyStatisticsRepository.findBetween(from, to).stream().map(this::toView).toList();
    return new DailyStatisticsResponse(from, to, statistics);
  }

  @GetMapping("/permanently-failed/count")
  public PermanentlyFailedCountResponse permanentlyFailedCount(
      @RequestParam(value = "days", defaultValue = "7") int days) {
    if (days < 1 || days > MAX_COUNT_DAYS) {
      throw new InvalidRequestException("days must be between 1 and " + MAX_COUNT_DAYS);
    }
    final Instant since = Instant.now(clock).minus(Duration.ofDays(days));
    final long count =
        notificationLogRepository.countByStatusSince(NotificationStatus.PERMANENTLY_FAILED, since);
    return new PermanentlyFailedCountResponse(days, since, count);
  }

  private NotificationView toView(NotificationRecord record) {
    return new NotificationView(
        record.notificationId(),
        record.appointmentId(),
        record.kind(),
        record.status(),
        record.attemptCount(),
        record.createdAt(),
        record.lastAttemptAt(),
        record.sentAt(),
        record.failureReason(),
        record.lastError(),
        parsePayload(record));
  }

  private DailyStatisticView toView(DailyStatistic statistic) {
    return new DailyStatisticView(
        statistic.statDate(), statistic.kind(), statistic.status(), statistic.recordCount());
  }

  private JsonNode parsePayload(NotificationRecord record) {
    try {
      return objectMapper.readTree(record.payloadJson());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "notification payload parse failure id=" + record.notificationId(), ex);
    }
  }
}
