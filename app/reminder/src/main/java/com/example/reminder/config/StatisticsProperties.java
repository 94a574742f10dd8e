/*
 * どこで: reminder 設定バインド
 * 何を: 日次統計集計のスケジュールと暦のタイムゾーン
 */
package com.example.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.statistics")
@Validated
public record StatisticsProperties(boolean enabled, @NotBlank String cron, String zone) {

  @AssertTrue(message = "notification.statistics.zone must be a valid zone id")
  public boolean isZoneValid() {
    return ZoneIds.isValid(zone);
  }

  /** 「前日」を計算する暦のタイムゾーン。 */
  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
