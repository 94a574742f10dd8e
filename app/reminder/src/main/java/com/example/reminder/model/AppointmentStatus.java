/*
 * どこで: appointment ビューモデル
 * 何を: 予約サブシステムが管理する appointment の状態
 */
package com.example.reminder.model;

public enum AppointmentStatus {
  PENDING,
  CONFIRMED,
  COMPLETED,
  CANCELLED
}
