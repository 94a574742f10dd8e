/*
 * どこで: reminder API モデル
 * 何を: 両端を含む日付範囲の日次集計
 */
package com.example.reminder.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailyStatisticsResponse(
    LocalDate from, LocalDate to, List<DailyStatisticView> statistics) {

  public DailyStatisticsResponse {
    statistics = statistics == null ? List.of() : List.copyOf(statistics);
  }
}
