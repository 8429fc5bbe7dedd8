/*
 * どこで: Queue API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: ドメインエラーの種類ごとにステータスと封筒形式を統一するため
 */
package com.example.queue.api;

import com.example.queue.repository.MessageStorageException;
import com.example.queue.service.InvalidMessageIdException;
import com.example.queue.service.InvalidQueueRequestException;
import com.example.queue.service.MessageBodyTooLargeException;
import com.example.queue.service.MissingMessageIdsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MessageBodyTooLargeException.class)
  public ResponseEntity<ApiResponse<Void>> handleBodyTooLarge(MessageBodyTooLargeException ex) {
    return badRequest(ApiErrorCode.BODY_TOO_LARGE, ex.getMessage());
  }

  @ExceptionHandler(MissingMessageIdsException.class)
  public ResponseEntity<ApiResponse<Void>> handleNoIds(MissingMessageIdsException ex) {
    return badRequest(ApiErrorCode.NO_IDS, ex.getMessage());
  }

  @ExceptionHandler(InvalidMessageIdException.class)
  public ResponseEntity<ApiResponse<Void>> handleInvalidId(InvalidMessageIdException ex) {
    return badRequest(ApiErrorCode.INVALID_ID, ex.getMessage());
  }

  @ExceptionHandler(MessageStorageException.class)
  public ResponseEntity<ApiResponse<Void>> handleStorage(MessageStorageException ex) {
    return badRequest(ApiErrorCode.STORAGE_ERROR, ex.getMessage());
  }

  @ExceptionHandler(InvalidQueueRequestException.class)
  public ResponseEntity<ApiResponse<Void>> handleInvalidRequest(InvalidQueueRequestException ex) {
    return badRequest(ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先する
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(text -> text != null && !text.isBlank())
            .findFirst()
            .orElse("request validation failed");
    return badRequest(ApiErrorCode.VALIDATION_ERROR, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない
    final String rawMessage = ex.getMessage() == null ? "" : ex.getMessage();
    final String message =
        rawMessage.contains("Required request body is missing")
            ? "request body is required"
            : "request body is invalid";
    return badRequest(ApiErrorCode.BAD_REQUEST, message);
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiResponse<Void>> handleRuntime(RuntimeException ex) {
    logger.error("unexpected error while handling queue request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiResponse.error(ApiErrorCode.INTERNAL_ERROR, "Internal server error"));
  }

  private ResponseEntity<ApiResponse<Void>> badRequest(ApiErrorCode code, String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error(code, message));
  }
}
