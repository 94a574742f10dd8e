/*
 * どこで: reminder サービス層
 * 何を: 1 日分の daily_notification_statistics を再集計する
 * なぜ: レポートがログを走査せず集計済みの件数を読むため
 */
package com.example.reminder.service;

import com.example.reminder.config.StatisticsProperties;
import com.example.reminder.repository.DailyStatisticsRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class StatisticsAggregationService {

  private static final Logger logger = LoggerFactory.getLogger(StatisticsAggregationService.class);

  private final DailyStatisticsRepository dailyStatisticsRepository;
  private final StatisticsProperties properties;
  private final Clock clock;

  @Transactional
  public int aggregatePreviousDay() {
    final LocalDate today = LocalDate.now(clock.withZone(properties.zoneId()));
    return rebuild(today.minusDays(1));
  }

  /** {@code day} の行をすべて置き換える。2 回実行しても結果は同じ。 */
  @Transactional
  public int aggregateFor(LocalDate day) {
    return rebuild(day);
  }

  private int rebuild(LocalDate day) {
    final ZoneId zone = properties.zoneId();
    final Instant from = day.atStartOfDay(zone).toInstant();
    final Instant to = day.plusDays(1).atStartOfDay(zone).toInstant();
    final int deleted = dailyStatisticsRepository.deleteForDate(day);
    final int written = dailyStatisticsRepository.aggregate(day, from, to, Instant.now(clock));
    logger.info(
        "notification statistics rebuilt day={} zone={} deleted={} written={}",
        day,
        zone,
        deleted,
        written);
    return written;
  }
}
