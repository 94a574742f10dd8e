/*
 * どこで: reminder 設定バインド
 * 何を: review request sweep の日次実行枠と、実行漏れ時にさかのぼる幅
 */
package com.example.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.review")
@Validated
public record ReviewRequestSweepProperties(
    boolean enabled, @NotBlank String cron, String zone, @NotNull Duration missedRunGrace) {

  private static final LocalDateTime CRON_REFERENCE = LocalDateTime.of(2026, 1, 5, 0, 0);

  @AssertTrue(message = "notification.review.zone must be a valid zone id")
  public boolean isZoneValid() {
    return ZoneIds.isValid(zone);
  }

  @AssertTrue(
      message = "notification.review.missed-run-grace must cover the interval between two runs")
  public boolean isMissedRunGraceCoveringOneRun() {
    if (missedRunGrace == null || missedRunGrace.isNegative() || !ZoneIds.isValid(zone)) {
      return false;
    }
    final Duration interval;
    try {
      interval = cronInterval();
    } catch (IllegalArgumentException ex) {
      return false;
    }
    return interval != null && missedRunGrace.compareTo(interval) >= 0;
  }

  private Duration cronInterval() {
    final CronExpression expression = CronExpression.parse(cron);
    final ZonedDateTime first = expression.next(CRON_REFERENCE.atZone(ZoneId.of(zone)));
    if (first == null) {
      return null;
    }
    final ZonedDateTime second = expression.next(first);
    return second == null ? null : Duration.between(first, second);
  }
}
