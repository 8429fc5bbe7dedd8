/*
 * どこで: Queue API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ 400 でも原因を区別できるようにするため
 */
package com.example.queue.api;

public enum ApiErrorCode {
  BODY_TOO_LARGE,
  NO_IDS,
  INVALID_ID,
  STORAGE_ERROR,
  BAD_REQUEST,
  VALIDATION_ERROR,
  INTERNAL_ERROR
}
