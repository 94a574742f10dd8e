/*
 * どこで: reminder API モデル
 * 何を: 予約サブシステムから届く appointment 遷移
 * なぜ: ボディに appointment のスナップショットを含め、読み直しを不要にするため
 */
package com.example.reminder.api;

import com.example.reminder.model.AppointmentStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AppointmentTransitionRequest(
    @NotNull(message = "appointment_id is required") UUID appointmentId,
    @NotNull(message = "business_id is required") UUID businessId,
    @NotNull(message = "client_id is required") UUID clientId,
    @NotNull(message = "scheduled_at is required") Instant scheduledAt,
    String timeZone,
    @NotNull(message = "status is required") AppointmentStatus status,
    AppointmentStatus previousStatus,
    Instant completedAt,
    String recipientRef,
    Instant occurredAt) {}
