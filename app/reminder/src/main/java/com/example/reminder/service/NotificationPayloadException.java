/*
 * どこで: reminder サービス層
 * 何を: 描画済みメッセージを payload JSON に書き出せなかったことを表す
 */
package com.example.reminder.service;

public class NotificationPayloadException extends RuntimeException {

  public NotificationPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
