/*
 * どこで: Arena API
 * 何を: ドメイン例外と依存先障害を HTTP レスポンスへ変換する
 * なぜ: エラー種別と安定コードを揃え、内部キーやスタックを応答に出さないため
 */
package com.example.arena.api;

import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSessionRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidSessionRequestException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.SESSION_NOT_FOUND, "session not found"));
  }

  @ExceptionHandler(QueueEntryNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleQueueEntryNotFound(
      QueueEntryNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.QUEUE_ENTRY_NOT_FOUND, "not in queue"));
  }

  @ExceptionHandler(SessionAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleAccessDenied(SessionAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(SessionConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleConflict(SessionConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final String message =
        ex.getAllErrors().stream()
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    if (ex.getCause() instanceof InvalidTypeIdException typeIdException) {
      if (typeIdException.getTypeId() == null) {
        return badRequest("event type is required");
      }
      // 未知のイベント種別は受け付けず、ログに残して 400 を返す
      logger.warn("unsupported event type rejected typeId={}", typeIdException.getTypeId());
      return badRequest("unsupported event type: " + typeIdException.getTypeId());
    }
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    logger.warn("dependency call failed", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiErrorResponse(
                ApiErrorCode.DEPENDENCY_UNAVAILABLE, "temporarily unavailable, retry later"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.VALIDATION_ERROR, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
