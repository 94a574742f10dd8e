package com.example.reminder.api;

import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailyStatisticView(
    LocalDate statDate, NotificationKind kind, NotificationStatus status, long recordCount) {}
