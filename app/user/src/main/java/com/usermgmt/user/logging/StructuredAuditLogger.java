/*
 * どこで: 監査ログ
 * 何を: AuditLogger の実装。sql_audit_log への追記とチャネル別の構造化ログ出力を行う
 * なぜ: HTTP/SQL/サービスエラーを 1 つの監査ストアで相関 ID 付きに追跡するため
 */
package com.usermgmt.user.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.usermgmt.common.CorrelationIds;
import com.usermgmt.common.SensitiveDataRedactor;
import com.usermgmt.user.model.AuditLogRecord;
import com.usermgmt.user.repository.AuditLogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StructuredAuditLogger implements AuditLogger {

  static final int SNIPPET_MAX_LENGTH = 200;
  static final Set<String> HIGH_SEVERITY_ACTIONS =
      Set.of("deleted", "force_deleted", "disabled", "locked", "banned");

  private final AuditLogRepository auditLogRepository;
  private final AuditLogChannels channels;
  private final AuditActorResolver actorResolver;
  private final AuditMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public void logHttpRequest(
      HttpRequestSnapshot request,
      int statusCode,
      Duration duration,
      boolean error,
      String message) {
    try {
      final String sqlText = "HTTP " + request.method() + " " + request.path();
      final String module = orUnknown(request.handler());
      writeRow(
          "http_request",
          () -> {
            final AuditActor actor = actorResolver.resolve();
            final Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("status_code", statusCode);
            payload.put("headers", SensitiveDataRedactor.redact(request.headers()));
            payload.put("query", SensitiveDataRedactor.redact(request.query()));
            payload.put("body", redactValue(request.body()));
            auditLogRepository.insert(
                new AuditLogRecord(
                    CorrelationIds.newAuditId(),
                    sqlText,
                    toJson(payload),
                    SqlOperation.HTTP_REQUEST,
                    toMillis(duration),
                    actor.name(),
                    actor.userId(),
                    module,
                    preferKnown(request.ipAddress(), actor.ipAddress()),
                    preferKnown(request.userAgent(), actor.userAgent()),
                    error,
                    message != null ? message : (error ? "Unknown Error" : "Success"),
                    Instant.now(clock)));
          });
      warnIfSlow("http_request", "Slow request detected: " + sqlText, duration, sqlText, module);
    } catch (RuntimeException ex) {
      reportWriteFailure("http_request", ex);
    }
  }

  @Override
  public void logSql(SqlStatement statement) {
    try {
      final SqlStatement resolved = resolveModule(statement);
      writeRow(
          "sql", () -> auditLogRepository.insert(toRecord(resolved, actorResolver.resolve())));
      warnIfSlow(resolved);
    } catch (RuntimeException ex) {
      reportWriteFailure("sql", ex);
    }
  }

  @Override
  public void logSqlBatch(List<SqlStatement> statements) {
    if (statements == null || statements.isEmpty()) {
      return;
    }
    try {
      final List<SqlStatement> resolved = new ArrayList<>(statements.size());
      for (SqlStatement statement : statements) {
        resolved.add(resolveModule(statement));
      }
      writeRow(
          "sql_batch",
          () -> {
            final AuditActor actor = actorResolver.resolve();
            final List<AuditLogRecord> records = new ArrayList<>(resolved.size());
            for (SqlStatement statement : resolved) {
              records.add(toRecord(statement, actor));
            }
            auditLogRepository.insertBatch(records);
          });
      resolved.forEach(this::warnIfSlow);
    } catch (RuntimeException ex) {
      reportWriteFailure("sql_batch", ex);
    }
  }

  @Override
  public void logDatabaseOperation(
      String operation,
      String entityType,
      Object entityId,
      Duration duration,
      Map<String, ?> metadata,
      boolean error,
      String message) {
    try {
      final String operationName = orUnknown(operation);
      final String entityName = orUnknown(entityType);
      final String module = CallerModuleResolver.resolve();
      final Map<String, Object> redactedMetadata = redactMap(metadata);
      final String sqlText =
          operationName.toUpperCase(Locale.ROOT)
              + " "
              + tableName(entityName)
              + (error ? " FAILED" : "");
      writeRow(
          "database_operation",
          () -> {
            final Map<String, Object> context = baseContext();
            context.put("operation", operationName);
            context.put("model", entityName);
            context.put("id", entityId == null ? null : String.valueOf(entityId));
            context.put("duration_ms", toMillis(duration));
            context.put("is_error", error);
            if (!redactedMetadata.isEmpty()) {
              context.put("metadata", redactedMetadata);
            }
            channels.write(
                AuditChannel.DATABASE,
                error ? Level.ERROR : Level.INFO,
                "Database Operation: " + operationName + " on " + entityName,
                context);

            final AuditActor actor = actorResolver.resolve();
            auditLogRepository.insert(
                new AuditLogRecord(
                    CorrelationIds.newAuditId(),
                    sqlText,
                    toJson(redactedMetadata),
                    SqlOperation.forServiceOperation(operationName, sqlText),
                    toMillis(duration),
                    actor.name(),
                    actor.userId(),
                    module,
                    actor.ipAddress(),
                    actor.userAgent(),
                    error,
                    message != null ? message : (error ? "Query Failed" : "Success"),
                    Instant.now(clock)));
          });
      warnIfSlow(
          "sql_query", "Slow query detected: " + operationName, duration, sqlText, module);
    } catch (RuntimeException ex) {
      reportWriteFailure("database_operation", ex);
    }
  }

  @Override
  public void logServiceError(
      String service, String method, Throwable error, Map<String, ?> context) {
    try {
      final String sqlText = "Service error in " + service + "::" + method;
      final Map<String, Object> errorContext = baseContext();
      errorContext.put("service", service);
      errorContext.put("method", method);
      putThrowable(errorContext, error);
      errorContext.putAll(redactMap(context));
      channels.write(
          AuditChannel.SERVICE_ERRORS,
          Level.ERROR,
          "Service Error: " + service + "::" + method,
          errorContext);

      final AuditActor actor = actorResolver.resolve();
      final Map<String, Object> params = new LinkedHashMap<>();
      params.put("error", error.getMessage());
      auditLogRepository.insert(
          new AuditLogRecord(
              CorrelationIds.newAuditId(),
              sqlText,
              toJson(params),
              SqlOperation.ERROR,
              0d,
              actor.name(),
              actor.userId(),
              service,
              actor.ipAddress(),
              actor.userAgent(),
              true,
              error.getMessage(),
              Instant.now(clock)));
    } catch (RuntimeException ex) {
      reportWriteFailure("service_error", ex);
    }
  }

  @Override
  public void logApiError(Throwable error, String method, String path, int statusCode) {
    try {
      final AuditActor actor = actorResolver.resolve();
      final Map<String, Object> context = baseContext();
      putThrowable(context, error);
      context.put("status_code", statusCode);
      final Map<String, Object> request = new LinkedHashMap<>();
      request.put("method", method);
      request.put("path", path);
      request.put("ip", actor.ipAddress());
      request.put("user_agent", actor.userAgent());
      request.put("user_id", actor.userId());
      context.put("request", request);
      final String message =
          error.getMessage() == null ? error.getClass().getName() : error.getMessage();
      channels.write(
          AuditChannel.API, statusCode >= 500 ? Level.ERROR : Level.WARN, message, context);
    } catch (RuntimeException ex) {
      reportWriteFailure("api_error", ex);
    }
  }

  @Override
  public void logApiRequest(HttpRequestSnapshot request, int statusCode, Duration duration) {
    try {
      final AuditActor actor = actorResolver.resolve();
      final Map<String, Object> context = baseContext();
      context.put("method", request.method());
      context.put("path", request.path());
      context.put("status_code", statusCode);
      context.put("duration_ms", toMillis(duration));
      context.put("ip", preferKnown(request.ipAddress(), actor.ipAddress()));
      context.put("user_agent", preferKnown(request.userAgent(), actor.userAgent()));
      context.put("user_id", actor.userId());
      final boolean failed = statusCode >= 400;
      final String prefix = failed ? "API request failed: " : "API request: ";
      channels.write(
          AuditChannel.API,
          failed ? Level.WARN : Level.INFO,
          prefix + request.method() + " " + request.path(),
          context);
    } catch (RuntimeException ex) {
      reportWriteFailure("api_request", ex);
    }
  }

  @Override
  public void logAuthEvent(String event, Long userId, Map<String, ?> data) {
    try {
      final AuditActor actor = actorResolver.resolve();
      final Map<String, Object> context = baseContext();
      context.put("event", event);
      context.put("user_id", userId != null ? userId : actor.userId());
      context.put("ip", actor.ipAddress());
      context.put("user_agent", actor.userAgent());
      context.putAll(redactMap(data));
      channels.write(AuditChannel.AUTH, Level.INFO, "Auth Event: " + event, context);
    } catch (RuntimeException ex) {
      reportWriteFailure("auth_event", ex);
    }
  }

  @Override
  public void logUserAction(String action, Long userId, String userEmail, Map<String, ?> data) {
    try {
      final AuditActor actor = actorResolver.resolve();
      final Map<String, Object> context = baseContext();
      context.put("action", action);
      context.put("user_id", userId);
      context.put("user_email", userEmail);
      context.put("actor", actor.name());
      context.put("ip", actor.ipAddress());
      context.putAll(redactMap(data));
      channels.write(
          AuditChannel.USER_ACTION,
          HIGH_SEVERITY_ACTIONS.contains(action) ? Level.WARN : Level.INFO,
          "User Action: " + action,
          context);
    } catch (RuntimeException ex) {
      reportWriteFailure("user_action", ex);
    }
  }

  @Override
  public void logPerformanceIssue(
      String operation,
      String message,
      Duration duration,
      Duration threshold,
      Map<String, ?> metadata) {
    try {
      final double durationMs = toMillis(duration);
      final double thresholdMs = toMillis(threshold);
      final Map<String, Object> context = baseContext();
      context.put("operation", operation);
      context.put("duration_ms", durationMs);
      context.put("threshold_ms", thresholdMs);
      context.put("exceeded_by_ms", round2(durationMs - thresholdMs));
      context.put("metadata", redactMap(metadata));
      context.put("user_id", actorResolver.resolve().userId());
      channels.write(AuditChannel.PERFORMANCE, Level.WARN, message, context);
      metrics.recordSlowOperation(operation);
    } catch (RuntimeException ex) {
      reportWriteFailure("performance", ex);
    }
  }

  private AuditLogRecord toRecord(SqlStatement statement, AuditActor actor) {
    final SqlOperation operation =
        statement.operation() != null
            ? statement.operation()
            : SqlOperation.detect(statement.sql());
    final String message =
        statement.message() != null
            ? statement.message()
            : (statement.error() ? "Query Failed" : "Success");
    return new AuditLogRecord(
        CorrelationIds.newAuditId(),
        statement.sql(),
        toJson(SensitiveDataRedactor.redact(statement.params())),
        operation,
        toMillis(statement.duration()),
        actor.name(),
        actor.userId(),
        statement.module(),
        actor.ipAddress(),
        actor.userAgent(),
        statement.error(),
        message,
        Instant.now(clock));
  }

  private SqlStatement resolveModule(SqlStatement statement) {
    if (statement.module() != null && !statement.module().isBlank()) {
      return statement;
    }
    return statement.withModule(CallerModuleResolver.resolve());
  }

  private void warnIfSlow(SqlStatement statement) {
    final String operation =
        statement.operation() != null
            ? statement.operation().name()
            : SqlOperation.detect(statement.sql()).name();
    warnIfSlow(
        "sql_query",
        "Slow query detected: " + operation,
        statement.duration(),
        statement.sql(),
        statement.module());
  }

  private void warnIfSlow(
      String kind, String message, Duration duration, String snippetSource, String module) {
    if (duration == null || duration.compareTo(SLOW_OPERATION_THRESHOLD) <= 0) {
      return;
    }
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("sql", truncate(snippetSource));
    metadata.put("module", module);
    logPerformanceIssue(kind, message, duration, SLOW_OPERATION_THRESHOLD, metadata);
  }

  /** 監査ストアへの書き込み失敗は fallback チャネルへ回し、後続の低速判定は続ける。 */
  private void writeRow(String shape, Runnable write) {
    try {
      write.run();
    } catch (RuntimeException ex) {
      reportWriteFailure(shape, ex);
    }
  }

  private void reportWriteFailure(String shape, RuntimeException ex) {
    metrics.recordWriteFailure(shape);
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("error", ex.getMessage());
    context.put("exception", ex.getClass().getName());
    context.put("type", shape);
    channels.write(AuditChannel.FALLBACK, Level.ERROR, "Failed to write audit log", context);
  }

  private Map<String, Object> baseContext() {
    final Map<String, Object> context = new LinkedHashMap<>();
    final String correlationId = MDC.get(AuditContextKeys.MDC_CORRELATION_ID);
    if (correlationId != null) {
      context.put(AuditContextKeys.MDC_CORRELATION_ID, correlationId);
    }
    context.put("timestamp", Instant.now(clock).toString());
    return context;
  }

  private static void putThrowable(Map<String, Object> context, Throwable error) {
    context.put("exception", error.getClass().getName());
    context.put("message", error.getMessage());
    final StackTraceElement[] trace = error.getStackTrace();
    if (trace.length > 0) {
      context.put("file", trace[0].getFileName());
      context.put("line", trace[0].getLineNumber());
    }
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize audit params", e);
    }
  }

  @SuppressWarnings("unchecked")
  static Object redactValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return SensitiveDataRedactor.redact((Map<String, ?>) map);
    }
    if (value instanceof Collection<?> items) {
      return items.stream().map(StructuredAuditLogger::redactValue).toList();
    }
    if (value instanceof String text) {
      return SensitiveDataRedactor.redact(text);
    }
    return value;
  }

  private static Map<String, Object> redactMap(Map<String, ?> value) {
    if (value == null || value.isEmpty()) {
      return new LinkedHashMap<>();
    }
    return SensitiveDataRedactor.redact(value);
  }

  static String tableName(String entityType) {
    final String simpleName =
        entityType.contains(".")
            ? entityType.substring(entityType.lastIndexOf('.') + 1)
            : entityType;
    return simpleName.toUpperCase(Locale.ROOT) + "S";
  }

  static String truncate(String value) {
    if (value == null || value.length() <= SNIPPET_MAX_LENGTH) {
      return value;
    }
    return value.substring(0, SNIPPET_MAX_LENGTH);
  }

  static double toMillis(Duration duration) {
    if (duration == null) {
      return 0d;
    }
    return round2(duration.toNanos() / 1_000_000d);
  }

  private static double round2(double value) {
    return Math.round(value * 100d) / 100d;
  }

  private static String orUnknown(String value) {
    return value == null || value.isBlank() ? CallerModuleResolver.UNKNOWN : value;
  }

  private static String preferKnown(String primary, String fallback) {
    return primary == null || primary.isBlank() || AuditActor.UNKNOWN.equals(primary)
        ? fallback
        : primary;
  }
}
