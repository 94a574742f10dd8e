/*
 * どこで: notification チャネル契約
 * 何を: チャネル送信の 2 通りの結果
 */
package com.example.reminder.model;

public sealed interface DeliveryResult permits DeliveryResult.Delivered, DeliveryResult.Failed {

  static DeliveryResult delivered() {
    return new Delivered();
  }

  static DeliveryResult transientFailure(String detail) {
    return new Failed(FailureReason.TRANSIENT, detail);
  }

  static DeliveryResult permanentFailure(String detail) {
    return new Failed(FailureReason.PERMANENT, detail);
  }

  record Delivered() implements DeliveryResult {}

  record Failed(FailureReason reason, String detail) implements DeliveryResult {}
}
