/*
 * どこで: appointment ビューモデル
 * 何を: 予約サブシステムが公開する appointment の読み取り専用スナップショット
 * なぜ: sweep と lifecycle トリガーが同じ形からメッセージを描画するため
 */
package com.example.reminder.model;

import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

public record Appointment(
    UUID appointmentId,
    UUID businessId,
    UUID clientId,
    Instant scheduledAt,
    ZoneId timeZone,
    AppointmentStatus status,
    Instant completedAt,
    String recipientRef) {}
