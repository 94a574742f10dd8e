/*
 * どこで: notification ドメインモデル
 * 何を: tryCreate の入力（描画済みで未保存の通知）
 */
package com.example.reminder.model;

import java.util.UUID;

public record NotificationDraft(
    UUID appointmentId, NotificationKind kind, String recipientRef, String payloadJson) {}
