/*
 * どこで: reminder API
 * 何を: ApiErrorResponse の機械判読用エラーコード
 */
package com.example.reminder.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  INTERNAL_ERROR
}
