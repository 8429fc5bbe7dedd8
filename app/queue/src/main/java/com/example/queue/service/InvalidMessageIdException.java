/*
 * どこで: Queue Service 層
 * 何を: 正規形でないメッセージ ID を表現する
 * なぜ: 最初の不正 ID で処理を打ち切り、その値をクライアントへ返すため
 */
package com.example.queue.service;

public class InvalidMessageIdException extends RuntimeException {

  private final String id;

  public InvalidMessageIdException(String id) {
    super("Invalid message ID: " + id);
    this.id = id;
  }

  public String id() {
    return id;
  }
}
