/*
 * どこで: app/user/src/main/java/com/usermgmt/user/model/AuditLogRecord.java
 * 何を: sql_audit_log テーブル相当のドメインレコード
 * なぜ: HTTP/SQL/サービスエラーを 1 つの追記専用ストアで追跡するため
 */
package com.usermgmt.user.model;

import com.usermgmt.user.logging.SqlOperation;
import java.time.Instant;

public record AuditLogRecord(
    String id,
    String sqlText,
    String sqlParamsJson,
    SqlOperation operation,
    double durationMs,
    String executedBy,
    Long userId,
    String module,
    String ipAddress,
    String userAgent,
    boolean error,
    String message,
    Instant createdAt) {

  public AuditLogRecord {
    operation = operation == null ? SqlOperation.UNKNOWN : operation;
    durationMs = Math.max(0d, durationMs);
  }
}
