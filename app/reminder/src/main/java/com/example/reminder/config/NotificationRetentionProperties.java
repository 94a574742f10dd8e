/*
 * どこで: reminder 設定バインド
 * 何を: 終端状態ごとの保持期間と削除スケジュール
 * なぜ: 保持方針とスケジュールを環境ごとに調整できるようにするため
 */
package com.example.reminder.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.retention")
@Validated
public record NotificationRetentionProperties(
    boolean enabled,
    @Positive int sentRetentionDays,
    @Positive int failedRetentionDays,
    @NotNull Duration stalePendingAfter,
    @NotBlank String cron) {}
