/*
 * どこで: notification ドメインモデル
 * 何を: notification_records 1 行のスナップショット
 * なぜ: dispatcher・sweep・監視 API で共有するため
 */
package com.example.reminder.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    UUID appointmentId,
    NotificationKind kind,
    NotificationStatus status,
    int attemptCount,
    String recipientRef,
    String payloadJson,
    Instant createdAt,
    Instant lastAttemptAt,
    Instant sentAt,
    FailureReason failureReason,
    String lastError,
    String lockedBy,
    Instant leaseUntil) {}
