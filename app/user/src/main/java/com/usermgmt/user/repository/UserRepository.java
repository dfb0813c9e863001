package com.usermgmt.user.repository;

import static com.usermgmt.common.JdbcTimestampUtils.toInstant;
import static com.usermgmt.common.JdbcTimestampUtils.toLocalDate;
import static com.usermgmt.common.JdbcTimestampUtils.toSqlDate;
import static com.usermgmt.common.JdbcTimestampUtils.toTimestamp;

import com.usermgmt.user.logging.SqlStatementCollector;
import com.usermgmt.user.model.Gender;
import com.usermgmt.user.model.UserRecord;
import com.usermgmt.user.model.UserStatistics;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserRepository {

  private static final String MODULE = "UserRepository";
  private static final String COLUMNS =
      """
      id, code, name, email, password, phone, date_of_birth, gender, avatar, email_verified_at,
      enabled, locked_until, lock_count, deleted_at, created_by, updated_by, deleted_by,
      created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final SqlStatementCollector sqlStatementCollector;

  public List<UserRecord> findPage(int limit, long offset) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM users
            WHERE deleted_at IS NULL
            ORDER BY created_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return query(sql, params);
  }

  public long countActive() {
    final String sql = "SELECT COUNT(*) FROM users WHERE deleted_at IS NULL";
    final MapSqlParameterSource params = new MapSqlParameterSource();
    return count(sql, params);
  }

  public List<UserRecord> search(String term, int limit, long offset) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM users
            WHERE deleted_at IS NULL
              AND (name ILIKE :pattern ESCAPE '\\'
                   OR email ILIKE :pattern ESCAPE '\\'
                   OR phone ILIKE :pattern ESCAPE '\\')
            ORDER BY created_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("pattern", likePattern(term))
            .addValue("limit", limit)
            .addValue("offset", offset);
    return query(sql, params);
  }

  public long countSearch(String term) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users
        WHERE deleted_at IS NULL
          AND (name ILIKE :pattern ESCAPE '\\'
               OR email ILIKE :pattern ESCAPE '\\'
               OR phone ILIKE :pattern ESCAPE '\\')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("pattern", likePattern(term));
    return count(sql, params);
  }

  public Optional<UserRecord> findById(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM users WHERE id = :id AND deleted_at IS NULL";
    return query(sql, new MapSqlParameterSource().addValue("id", id)).stream().findFirst();
  }

  /** 論理削除済みの行も対象にする (restore/force delete 用)。 */
  public Optional<UserRecord> findByIdWithDeleted(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM users WHERE id = :id";
    return query(sql, new MapSqlParameterSource().addValue("id", id)).stream().findFirst();
  }

  public Optional<UserRecord> findByCode(String code) {
    final String sql =
        "SELECT " + COLUMNS + " FROM users WHERE code = :code AND deleted_at IS NULL";
    return query(sql, new MapSqlParameterSource().addValue("code", code)).stream().findFirst();
  }

  public Optional<UserRecord> findByEmail(String email) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM users WHERE lower(email) = lower(:email) AND deleted_at IS NULL";
    return query(sql, new MapSqlParameterSource().addValue("email", email)).stream().findFirst();
  }

  /** code は論理削除済みの行とも重複させない。 */
  public boolean existsByCode(String code) {
    final String sql = "SELECT COUNT(*) FROM users WHERE code = :code";
    return count(sql, new MapSqlParameterSource().addValue("code", code)) > 0;
  }

  public boolean existsByEmail(String email, Long excludeId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users
        WHERE lower(email) = lower(:email)
          AND deleted_at IS NULL
          AND (CAST(:excludeId AS BIGINT) IS NULL OR id <> :excludeId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("email", email)
            .addValue("excludeId", excludeId, Types.BIGINT);
    return count(sql, params) > 0;
  }

  public boolean existsByPhone(String phone, Long excludeId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM users
        WHERE phone = :phone
          AND deleted_at IS NULL
          AND (CAST(:excludeId AS BIGINT) IS NULL OR id <> :excludeId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("phone", phone)
            .addValue("excludeId", excludeId, Types.BIGINT);
    return count(sql, params) > 0;
  }

  public UserRecord insert(UserRecord user) {
    final String sql =
        """
        INSERT INTO users (code, name, email, password, phone, date_of_birth, gender, avatar,
                           email_verified_at, enabled, locked_until, lock_count, created_by,
                           updated_by, created_at, updated_at)
        VALUES (:code, :name, :email, :password, :phone, :dateOfBirth, :gender, :avatar,
                :emailVerifiedAt, :enabled, :lockedUntil, :lockCount, :createdBy,
                :updatedBy, :createdAt, :updatedAt)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        profileParams(user)
            .addValue("code", user.code())
            .addValue("emailVerifiedAt", toTimestamp(user.emailVerifiedAt()), Types.TIMESTAMP)
            .addValue("enabled", user.enabled())
            .addValue("lockedUntil", toTimestamp(user.lockedUntil()), Types.TIMESTAMP)
            .addValue("lockCount", user.lockCount())
            .addValue("createdBy", user.createdBy(), Types.BIGINT)
            .addValue("createdAt", toTimestamp(user.createdAt()))
            .addValue("updatedAt", toTimestamp(user.updatedAt()));
    return querySingle(sql, params);
  }

  public UserRecord updateProfile(UserRecord user, Instant now) {
    final String sql =
        """
        UPDATE users
        SET name = :name,
            email = :email,
            password = :password,
            phone = :phone,
            date_of_birth = :dateOfBirth,
            gender = :gender,
            avatar = :avatar,
            updated_by = :updatedBy,
            updated_at = :updatedAt
        WHERE id = :id
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        profileParams(user).addValue("id", user.id()).addValue("updatedAt", toTimestamp(now));
    return querySingle(sql, params);
  }

  public Optional<UserRecord> softDelete(long id, Long deletedBy, Instant now) {
    final String sql =
        """
        UPDATE users
        SET deleted_at = :now,
            deleted_by = :deletedBy,
            updated_at = :now
        WHERE id = :id AND deleted_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("deletedBy", deletedBy, Types.BIGINT)
            .addValue("now", toTimestamp(now));
    return query(sql, params).stream().findFirst();
  }

  public Optional<UserRecord> restore(long id, Long updatedBy, Instant now) {
    final String sql =
        """
        UPDATE users
        SET deleted_at = NULL,
            deleted_by = NULL,
            updated_by = :updatedBy,
            updated_at = :now
        WHERE id = :id AND deleted_at IS NOT NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("updatedBy", updatedBy, Types.BIGINT)
            .addValue("now", toTimestamp(now));
    return query(sql, params).stream().findFirst();
  }

  public int forceDelete(long id) {
    final String sql = "DELETE FROM users WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return sqlStatementCollector.track(
        MODULE, sql, params.getValues(), () -> jdbcTemplate.update(sql, params));
  }

  public Optional<UserRecord> updateLock(
      long id, Instant lockedUntil, int lockCount, Long updatedBy, Instant now) {
    final String sql =
        """
        UPDATE users
        SET locked_until = :lockedUntil,
            lock_count = :lockCount,
            updated_by = :updatedBy,
            updated_at = :now
        WHERE id = :id AND deleted_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("lockedUntil", toTimestamp(lockedUntil), Types.TIMESTAMP)
            .addValue("lockCount", lockCount)
            .addValue("updatedBy", updatedBy, Types.BIGINT)
            .addValue("now", toTimestamp(now));
    return query(sql, params).stream().findFirst();
  }

  public Optional<UserRecord> updateEnabled(
      long id, boolean enabled, Long updatedBy, Instant now) {
    final String sql =
        """
        UPDATE users
        SET enabled = :enabled,
            updated_by = :updatedBy,
            updated_at = :now
        WHERE id = :id AND deleted_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("enabled", enabled)
            .addValue("updatedBy", updatedBy, Types.BIGINT)
            .addValue("now", toTimestamp(now));
    return query(sql, params).stream().findFirst();
  }

  public UserStatistics statistics(Instant now) {
    final String sql =
        """
        SELECT COUNT(*) AS total_users,
               COUNT(*) FILTER (WHERE enabled) AS active_users,
               COUNT(*) FILTER (WHERE NOT enabled) AS disabled_users,
               COUNT(*) FILTER (WHERE locked_until > :now) AS locked_users,
               COUNT(*) FILTER (WHERE email_verified_at IS NOT NULL) AS verified_users
        FROM users
        WHERE deleted_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return sqlStatementCollector.track(
        MODULE,
        sql,
        params.getValues(),
        () ->
            jdbcTemplate.queryForObject(
                sql,
                params,
                (rs, rowNum) ->
                    new UserStatistics(
                        rs.getLong("total_users"),
                        rs.getLong("active_users"),
                        rs.getLong("disabled_users"),
                        rs.getLong("locked_users"),
                        rs.getLong("verified_users"))));
  }

  private MapSqlParameterSource profileParams(UserRecord user) {
    return new MapSqlParameterSource()
        .addValue("name", user.name())
        .addValue("email", user.email())
        .addValue("password", user.passwordHash())
        .addValue("phone", user.phone(), Types.VARCHAR)
        .addValue("dateOfBirth", toSqlDate(user.dateOfBirth()), Types.DATE)
        .addValue("gender", user.gender() == null ? null : user.gender().value(), Types.VARCHAR)
        .addValue("avatar", user.avatar(), Types.VARCHAR)
        .addValue("updatedBy", user.updatedBy(), Types.BIGINT);
  }

  private List<UserRecord> query(String sql, MapSqlParameterSource params) {
    return sqlStatementCollector.track(
        MODULE, sql, params.getValues(), () -> jdbcTemplate.query(sql, params, this::mapRow));
  }

  private UserRecord querySingle(String sql, MapSqlParameterSource params) {
    return sqlStatementCollector.track(
        MODULE,
        sql,
        params.getValues(),
        () -> jdbcTemplate.queryForObject(sql, params, this::mapRow));
  }

  private long count(String sql, MapSqlParameterSource params) {
    final Long count =
        sqlStatementCollector.track(
            MODULE,
            sql,
            params.getValues(),
            () -> jdbcTemplate.queryForObject(sql, params, Long.class));
    return count == null ? 0L : count;
  }

  static String likePattern(String term) {
    final String escaped =
        term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    return "%" + escaped + "%";
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getLong("id"),
        rs.getString("code"),
        rs.getString("name"),
        rs.getString("email"),
        rs.getString("password"),
        rs.getString("phone"),
        toLocalDate(rs.getDate("date_of_birth")),
        Gender.fromValue(rs.getString("gender")),
        rs.getString("avatar"),
        toInstant(rs.getTimestamp("email_verified_at")),
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp("locked_until")),
        rs.getInt("lock_count"),
        toInstant(rs.getTimestamp("deleted_at")),
        nullableLong(rs, "created_by"),
        nullableLong(rs, "updated_by"),
        nullableLong(rs, "deleted_by"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private static Long nullableLong(ResultSet rs, String column) throws SQLException {
    final long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }
}
