/*
 * どこで: notification ドメインモデル
 * 何を: daily_notification_statistics の 1 行
 */
package com.example.reminder.model;

import java.time.LocalDate;

public record DailyStatistic(
    LocalDate statDate, NotificationKind kind, NotificationStatus status, long recordCount) {}
