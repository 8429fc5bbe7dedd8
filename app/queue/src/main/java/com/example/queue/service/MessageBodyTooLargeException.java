/*
 * どこで: Queue Service 層
 * 何を: 本文サイズ上限超過を表現する
 * なぜ: 保存前に拒否した add を 400 応答へ変換するため
 */
package com.example.queue.service;

public class MessageBodyTooLargeException extends RuntimeException {

  private final long size;
  private final long limit;

  public MessageBodyTooLargeException(long size, long limit) {
    super("Message body size is too large");
    this.size = size;
    this.limit = limit;
  }

  public long size() {
    return size;
  }

  public long limit() {
    return limit;
  }
}
