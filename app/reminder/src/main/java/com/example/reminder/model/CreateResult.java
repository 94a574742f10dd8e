/*
 * どこで: notification ドメインモデル
 * 何を: (appointment_id, kind) 一意制約下での通知挿入結果
 */
package com.example.reminder.model;

import java.util.UUID;

public sealed interface CreateResult permits CreateResult.Created, CreateResult.AlreadyExists {

  record Created(NotificationRecord record) implements CreateResult {}

  record AlreadyExists(UUID appointmentId, NotificationKind kind) implements CreateResult {}
}
