/*
 * どこで: Queue Repository 層
 * 何を: ストレージ操作の失敗を表現する
 * なぜ: 実装固有の失敗を単一の種別として API の 400 応答へ正規化するため
 */
package com.example.queue.repository;

public class MessageStorageException extends RuntimeException {
  public MessageStorageException(String message) {
    super(message);
  }

  public MessageStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
