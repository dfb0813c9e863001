/*
 * どこで: app/user/src/main/java/com/usermgmt/user/api/ApiExceptionHandler.java
 * 何を: User API の例外を共通エンベロープ形式へ変換する
 * なぜ: 失敗時の契約を一定に保ち、すべての例外を API エラーチャネルへ残すため
 */
package com.usermgmt.user.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.usermgmt.user.api.response.ApiResponder;
import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.api.response.ResponseEnvelope;
import com.usermgmt.user.config.UserApiProperties;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.service.UserConflictException;
import com.usermgmt.user.service.UserNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

  private static final PropertyNamingStrategies.NamingBase SNAKE_CASE =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  private final ApiResponderFactory responders;
  private final AuditLogger auditLogger;
  private final UserApiProperties properties;

  /**
   * 役割:
   * - リクエストボディの入力制約違反を 422 へマッピングする。
   *
   * 期待動作:
   * - フィールドごとのメッセージを [{field, messages}] で返す。
   * - 利用者が修正できる失敗なのでサービスエラーとしては記録しない。
   */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ResponseEnvelope> handleBodyValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.UNPROCESSABLE_ENTITY);
    final Map<String, List<String>> errors = new LinkedHashMap<>();
    for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
      addError(errors, fieldError.getField(), fieldError.getDefaultMessage());
    }
    for (ObjectError globalError : ex.getBindingResult().getGlobalErrors()) {
      addError(errors, globalError.getObjectName(), globalError.getDefaultMessage());
    }
    return responder(request).validationError(errors);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ResponseEnvelope> handleParameterValidation(
      HandlerMethodValidationException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.UNPROCESSABLE_ENTITY);
    final Map<String, List<String>> errors = new LinkedHashMap<>();
    ex.getParameterValidationResults()
        .forEach(
            result -> {
              final String name = result.getMethodParameter().getParameterName();
              for (MessageSourceResolvable error : result.getResolvableErrors()) {
                addError(errors, name == null ? "parameter" : name, error.getDefaultMessage());
              }
            });
    return responder(request).validationError(errors);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ResponseEnvelope> handleConstraintViolation(
      ConstraintViolationException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.UNPROCESSABLE_ENTITY);
    final Map<String, List<String>> errors = new LinkedHashMap<>();
    for (ConstraintViolation<?> violation : ex.getConstraintViolations()) {
      final String path = violation.getPropertyPath().toString();
      final String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
      addError(errors, field, violation.getMessage());
    }
    return responder(request).validationError(errors);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ResponseEnvelope> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.UNPROCESSABLE_ENTITY);
    return responder(request)
        .validationError("Malformed or unreadable request body", "Validation failed");
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ResponseEnvelope> handleUserNotFound(
      UserNotFoundException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.NOT_FOUND);
    return responder(request).notFound(null, "User");
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ResponseEnvelope> handleNoResource(
      NoResourceFoundException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.NOT_FOUND);
    return responder(request).notFound("Resource not found", null);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ResponseEnvelope> handleMethodNotAllowed(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.METHOD_NOT_ALLOWED);
    return responder(request).error("Method not allowed", HttpStatus.METHOD_NOT_ALLOWED);
  }

  @ExceptionHandler(UserConflictException.class)
  public ResponseEntity<ResponseEnvelope> handleConflict(
      UserConflictException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.CONFLICT);
    return responder(request)
        .conflict(ex.getMessage(), Map.of(ex.getField(), List.of(ex.getMessage())));
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ResponseEnvelope> handleDataIntegrity(
      DataIntegrityViolationException ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.CONFLICT);
    return responder(request).conflict("The request conflicts with existing data", null);
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ResponseEnvelope> handleBadRequest(
      Exception ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.BAD_REQUEST);
    final String message =
        ex instanceof MethodArgumentTypeMismatchException mismatch
            ? "Invalid value for parameter '" + mismatch.getName() + "'"
            : ex.getMessage();
    return responder(request).error(message, HttpStatus.BAD_REQUEST);
  }

  /**
   * 役割:
   * - 想定外の例外を 500 へマッピングする。
   *
   * 期待動作:
   * - production では例外メッセージを返さず固定文言にする。
   * - サービスエラーチャネルにも記録する。
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ResponseEnvelope> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    logApiError(ex, request, HttpStatus.INTERNAL_SERVER_ERROR);
    final String message =
        properties.isProduction() || ex.getMessage() == null
            ? "Internal server error"
            : ex.getMessage();
    return responder(request).serverError(message, ex);
  }

  private void logApiError(Exception ex, HttpServletRequest request, HttpStatus status) {
    auditLogger.logApiError(ex, request.getMethod(), request.getRequestURI(), status.value());
  }

  private ApiResponder responder(HttpServletRequest request) {
    return responders.create(request).withRequestCorrelationId();
  }

  private static void addError(Map<String, List<String>> errors, String field, String message) {
    errors
        .computeIfAbsent(SNAKE_CASE.translate(field), ignored -> new ArrayList<>())
        .add(message);
  }
}
