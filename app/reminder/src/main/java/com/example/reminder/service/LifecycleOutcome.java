/*
 * どこで: reminder サービス層
 * 何を: appointment 遷移 1 件の処理結果
 */
package com.example.reminder.service;

public enum LifecycleOutcome {
  /** レコードを作成し、チャネル呼び出しは lifecycle Executor で行う。 */
  ENQUEUED,
  /** この appointment と種別のレコードが既に存在する。 */
  ALREADY_EXISTS,
  /** COMPLETED。次の実行枠で review request sweep が扱う。 */
  DEFERRED,
  /** 遷移後の状態に対応する通知がない。 */
  NOT_APPLICABLE,
  /** レコードを保存できなかった。 */
  ENQUEUE_FAILED,
  /** レコードは作成したが Executor が満杯。リース切れ後に retry sweep が送る。 */
  QUEUED_FOR_RECOVERY
}
