/*
 * どこで: Queue API
 * 何を: 成功/失敗共通のレスポンス封筒を定義する
 * なぜ: すべてのエンドポイントで data と error を同じ形で返すため
 */
package com.example.queue.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

@JsonInclude(JsonInclude.Include.NON_NULL)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record ApiResponse<T>(boolean success, T data, ApiErrorResponse error) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data, null);
  }

  public static <T> ApiResponse<T> error(ApiErrorCode code, String message) {
    return new ApiResponse<>(false, null, new ApiErrorResponse(code, message));
  }
}
