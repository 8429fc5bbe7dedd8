package com.example.queue.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.queue.repository.MessageStorageException;
import com.example.queue.service.InvalidMessageIdException;
import com.example.queue.service.InvalidQueueRequestException;
import com.example.queue.service.MessageBodyTooLargeException;
import com.example.queue.service.MissingMessageIdsException;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleBodyTooLargeReturns400() {
    final var response = handler.handleBodyTooLarge(new MessageBodyTooLargeException(10, 5));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(
            ApiResponse.error(ApiErrorCode.BODY_TOO_LARGE, "Message body size is too large"));
  }

  @Test
  void handleNoIdsReturns400() {
    final var response = handler.handleNoIds(new MissingMessageIdsException());

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().error().code()).isEqualTo(ApiErrorCode.NO_IDS);
  }

  @Test
  void handleInvalidIdEchoesOffendingId() {
    final var response = handler.handleInvalidId(new InvalidMessageIdException("xyz"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().success()).isFalse();
    assertThat(response.getBody().error())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.INVALID_ID, "Invalid message ID: xyz"));
  }

  @Test
  void handleStorageReturns400WithStoreMessage() {
    final var response = handler.handleStorage(new MessageStorageException("lock poisoned"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().error())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.STORAGE_ERROR, "lock poisoned"));
  }

  @Test
  void handleInvalidRequestReturns400() {
    final var response =
        handler.handleInvalidRequest(new InvalidQueueRequestException("count must not be negative"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().error().code()).isEqualTo(ApiErrorCode.BAD_REQUEST);
  }

  @Test
  void handleValidationReturnsFirstFieldMessage() throws NoSuchMethodException {
    final BeanPropertyBindingResult bindingResult =
        new BeanPropertyBindingResult(new Object(), "request");
    bindingResult.addError(new FieldError("request", "body", "body is required"));

    final var response = handler.handleValidation(validationFailure(bindingResult));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().error())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.VALIDATION_ERROR, "body is required"));
  }

  @Test
  void handleValidationFallsBackWhenNoFieldMessage() throws NoSuchMethodException {
    final BeanPropertyBindingResult bindingResult =
        new BeanPropertyBindingResult(new Object(), "request");

    final var response = handler.handleValidation(validationFailure(bindingResult));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().error())
        .isEqualTo(
            new ApiErrorResponse(ApiErrorCode.VALIDATION_ERROR, "request validation failed"));
  }

  @Test
  void handleRuntimeReturns500WithoutLeakingDetail() {
    final var response = handler.handleRuntime(new RuntimeException("secret detail"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().error())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "Internal server error"));
    assertThat(response.getBody().data()).isNull();
  }

  private MethodArgumentNotValidException validationFailure(BeanPropertyBindingResult result)
      throws NoSuchMethodException {
    final MethodParameter parameter =
        new MethodParameter(
            ApiExceptionHandlerTest.class.getDeclaredMethod("validationTarget", Object.class), 0);
    return new MethodArgumentNotValidException(parameter, result);
  }

  @SuppressWarnings("unused")
  private void validationTarget(Object request) {}
}
