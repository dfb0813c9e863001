package com.usermgmt.user.repository;

import static com.usermgmt.common.JdbcTimestampUtils.toTimestamp;

import com.usermgmt.user.model.AuditLogRecord;
import java.sql.Types;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

/** Append-only writer for sql_audit_log. Statements issued here are never themselves audited. */
@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuditLogRepository {

  private static final String INSERT_SQL =
      """
      INSERT INTO sql_audit_log (id, sql_text, sql_params, operation, duration_ms, executed_by,
                                 user_id, module, ip_address, user_agent, is_error, message,
                                 created_at, updated_at)
      VALUES (:id, :sqlText, CAST(:sqlParams AS jsonb), :operation, :durationMs, :executedBy,
              :userId, :module, :ipAddress, :userAgent, :isError, :message,
              :createdAt, :createdAt)
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditLogRecord auditLogRecord) {
    jdbcTemplate.update(INSERT_SQL, params(auditLogRecord));
  }

  /** 複数行を 1 回のバッチで書き込む。 */
  public void insertBatch(List<AuditLogRecord> auditLogRecords) {
    if (auditLogRecords.isEmpty()) {
      return;
    }
    final SqlParameterSource[] batch =
        auditLogRecords.stream().map(this::params).toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(INSERT_SQL, batch);
  }

  private MapSqlParameterSource params(AuditLogRecord auditLogRecord) {
    return new MapSqlParameterSource()
        .addValue("id", auditLogRecord.id())
        .addValue("sqlText", auditLogRecord.sqlText())
        .addValue("sqlParams", auditLogRecord.sqlParamsJson())
        .addValue("operation", auditLogRecord.operation().name())
        .addValue("durationMs", auditLogRecord.durationMs())
        .addValue("executedBy", auditLogRecord.executedBy())
        .addValue("userId", auditLogRecord.userId(), Types.BIGINT)
        .addValue("module", auditLogRecord.module())
        .addValue("ipAddress", auditLogRecord.ipAddress())
        .addValue("userAgent", auditLogRecord.userAgent())
        .addValue("isError", auditLogRecord.error())
        .addValue("message", auditLogRecord.message(), Types.VARCHAR)
        .addValue("createdAt", toTimestamp(auditLogRecord.createdAt()));
  }
}
