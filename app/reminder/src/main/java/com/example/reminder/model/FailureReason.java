/*
 * どこで: notification ドメインモデル
 * 何を: チャネルが報告する送信失敗の分類
 */
package com.example.reminder.model;

public enum FailureReason {
  /** ネットワークエラー、レート制限、タイムアウト。 */
  TRANSIENT,
  /** 宛先が不正または未登録、payload が読めない。 */
  PERMANENT
}
