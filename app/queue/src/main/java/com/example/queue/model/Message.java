/*
 * Where: Queue domain model
 * What: Immutable message value that flows between service, storage and API
 * Why: Storage enacts every transition by building a successor value, so no caller can alter stored state
 */
package com.example.queue.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Message(
    UUID id, String body, MessageState state, Instant lockUntil, int retryCount) {

  /**
   * 役割: 新規メッセージを生成する。
   * 動作: 時刻順にソート可能な ID を採番し、READY / retry_count=0 / lock_until なしで返す。
   * 前提: body のサイズ検証は呼び出し側(QueueService)で完了していること。
   */
  public static Message create(String body) {
    return new Message(MessageIds.newId(), body, MessageState.READY, null, 0);
  }
}
