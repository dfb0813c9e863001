/*
 * どこで: 監査ログ
 * 何を: リポジトリが発行した SQL を計測し、リクエスト単位で溜めてまとめて監査ログへ渡す
 * なぜ: 1 リクエスト中の SQL を 1 回の一括書き込みで記録し、主処理への影響を抑えるため
 */
package com.usermgmt.user.logging;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Times repository statements and buffers them for the current request.
 *
 * <p>Outside a capture window (no {@link #begin()} on this thread) each statement is logged
 * immediately through {@link AuditLogger#logSql}.
 */
@Component
public class SqlStatementCollector {

  private static final ThreadLocal<List<SqlStatement>> CAPTURED = new ThreadLocal<>();

  private final AuditLogger auditLogger;

  public SqlStatementCollector(AuditLogger auditLogger) {
    this.auditLogger = auditLogger;
  }

  public void begin() {
    CAPTURED.set(new ArrayList<>());
  }

  public boolean isCapturing() {
    return CAPTURED.get() != null;
  }

  /** Ends the capture window and returns what was recorded, in execution order. */
  public List<SqlStatement> drain() {
    final List<SqlStatement> statements = CAPTURED.get();
    CAPTURED.remove();
    return statements == null ? List.of() : List.copyOf(statements);
  }

  public <T> T track(String module, String sql, Map<String, ?> params, Supplier<T> execution) {
    final long startedAt = System.nanoTime();
    try {
      final T result = execution.get();
      record(module, sql, params, Duration.ofNanos(System.nanoTime() - startedAt), false, null);
      return result;
    } catch (RuntimeException ex) {
      record(
          module,
          sql,
          params,
          Duration.ofNanos(System.nanoTime() - startedAt),
          true,
          ex.getMessage());
      throw ex;
    }
  }

  private void record(
      String module,
      String sql,
      Map<String, ?> params,
      Duration duration,
      boolean error,
      String message) {
    final SqlStatement statement =
        new SqlStatement(
            sql,
            params == null ? Map.of() : new LinkedHashMap<>(params),
            null,
            duration,
            module,
            error,
            message);
    final List<SqlStatement> captured = CAPTURED.get();
    if (captured != null) {
      captured.add(statement);
    } else {
      auditLogger.logSql(statement);
    }
  }
}
