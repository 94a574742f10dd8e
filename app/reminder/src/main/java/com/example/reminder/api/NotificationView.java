/*
 * どこで: reminder API モデル
 * 何を: 監視エンドポイントが返す通知 1 件
 */
package com.example.reminder.api;

import com.example.reminder.model.FailureReason;
import com.example.reminder.model.NotificationKind;
import com.example.reminder.model.NotificationStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationView(
    UUID notificationId,
    UUID appointmentId,
    NotificationKind kind,
    NotificationStatus status,
    int attemptCount,
    Instant createdAt,
    Instant lastAttemptAt,
    Instant sentAt,
    FailureReason failureReason,
    String lastError,
    JsonNode payload) {}
