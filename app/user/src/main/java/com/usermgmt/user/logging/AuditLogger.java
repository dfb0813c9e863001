/*
 * どこで: 監査ログ
 * 何を: HTTP/SQL/サービスエラー/業務イベントを記録する単一の窓口
 * なぜ: 呼び出し側を永続化先やチャネル構成から切り離し、テストで差し替え可能にするため
 */
package com.usermgmt.user.logging;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 役割:
 * - 監査ストア (sql_audit_log) とログチャネルへの書き込みをまとめて提供する。
 *
 * 期待動作:
 * - どのメソッドも呼び出し元へ例外を投げない。書き込み失敗は fallback チャネルへ記録する。
 * - 記録前に機密値をマスクする。
 */
public interface AuditLogger {

  Duration SLOW_OPERATION_THRESHOLD = Duration.ofMillis(1000);

  void logHttpRequest(
      HttpRequestSnapshot request, int statusCode, Duration duration, boolean error, String message);

  void logSql(SqlStatement statement);

  /** 全行を 1 回の書き込みで追加する。失敗時は 1 行も残らない。 */
  void logSqlBatch(List<SqlStatement> statements);

  void logDatabaseOperation(
      String operation,
      String entityType,
      Object entityId,
      Duration duration,
      Map<String, ?> metadata,
      boolean error,
      String message);

  default void logDatabaseOperation(
      String operation,
      String entityType,
      Object entityId,
      Duration duration,
      Map<String, ?> metadata) {
    logDatabaseOperation(operation, entityType, entityId, duration, metadata, false, null);
  }

  void logServiceError(String service, String method, Throwable error, Map<String, ?> context);

  void logApiError(Throwable error, String method, String path, int statusCode);

  void logApiRequest(HttpRequestSnapshot request, int statusCode, Duration duration);

  void logAuthEvent(String event, Long userId, Map<String, ?> data);

  void logUserAction(String action, Long userId, String userEmail, Map<String, ?> data);

  void logPerformanceIssue(
      String operation,
      String message,
      Duration duration,
      Duration threshold,
      Map<String, ?> metadata);
}
