package com.usermgmt.user.repository;

import static com.usermgmt.common.JdbcTimestampUtils.toTimestamp;

import com.usermgmt.user.logging.SqlStatementCollector;
import java.sql.Types;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class PermissionRepository {

  private static final String MODULE = "PermissionRepository";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final SqlStatementCollector sqlStatementCollector;

  /** resource_id が NULL の付与はリソース種別全体に効く。 */
  public boolean exists(long userId, String resource, String action, Long resourceId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM permissions
        WHERE user_id = :userId
          AND resource = :resource
          AND action = :action
          AND (resource_id IS NULL OR resource_id = CAST(:resourceId AS BIGINT))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("resource", resource)
            .addValue("action", action)
            .addValue("resourceId", resourceId, Types.BIGINT);
    final Long count =
        sqlStatementCollector.track(
            MODULE,
            sql,
            params.getValues(),
            () -> jdbcTemplate.queryForObject(sql, params, Long.class));
    return count != null && count > 0;
  }

  public int grant(long userId, String resource, String action, Long resourceId, Instant now) {
    final String sql =
        """
        INSERT INTO permissions (user_id, resource, action, resource_id, created_at)
        VALUES (:userId, :resource, :action, :resourceId, :createdAt)
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("resource", resource)
            .addValue("action", action)
            .addValue("resourceId", resourceId, Types.BIGINT)
            .addValue("createdAt", toTimestamp(now));
    return sqlStatementCollector.track(
        MODULE, sql, params.getValues(), () -> jdbcTemplate.update(sql, params));
  }
}
