/*
 * どこで: app/user/src/main/java/com/usermgmt/user/service/UserService.java
 * 何を: ユーザーの作成/更新/削除/ロック/有効化/検索/統計を提供する
 * なぜ: 永続化操作ごとに所要時間と結果を監査ログへ一貫して残すため
 */
package com.usermgmt.user.service;

import com.usermgmt.user.api.request.UserCreateRequest;
import com.usermgmt.user.api.request.UserUpdateRequest;
import com.usermgmt.user.logging.AuditActorResolver;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.model.Gender;
import com.usermgmt.user.model.PageResult;
import com.usermgmt.user.model.UserRecord;
import com.usermgmt.user.model.UserStatistics;
import com.usermgmt.user.repository.UserRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserService {

  private static final Logger logger = LoggerFactory.getLogger(UserService.class);

  static final String SERVICE_NAME = "UserService";
  static final String ENTITY_TYPE = "User";
  static final String PASSWORD_CHANGE_MARKER = "[changed]";
  static final long MAX_LOCK_SECONDS = 31_536_000L;

  private static final String CODE_CONSTRAINT = "ux_users_code";
  private static final String EMAIL_CONSTRAINT = "ux_users_email_active";
  private static final String PHONE_CONSTRAINT = "ux_users_phone_active";

  private final UserRepository userRepository;
  private final UserCodeGenerator userCodeGenerator;
  private final PasswordEncoder passwordEncoder;
  private final AuditLogger auditLogger;
  private final AuditActorResolver actorResolver;
  private final Clock clock;

  public PageResult<UserRecord> list(int page, int perPage) {
    return execute(
        "list",
        "getAllUsers",
        null,
        () -> {
          final long offset = PageResult.offsetOf(page, perPage);
          final List<UserRecord> items = userRepository.findPage(perPage, offset);
          return new PageResult<>(items, page, perPage, userRepository.countActive());
        },
        result ->
            new UserAction(
                "listed",
                null,
                null,
                Map.of("page", page, "per_page", perPage, "result_count", result.items().size())));
  }

  public PageResult<UserRecord> search(String query, int page, int perPage) {
    final String term = query == null ? "" : query.trim();
    return execute(
        "search",
        "searchUsers",
        null,
        () -> {
          final long offset = PageResult.offsetOf(page, perPage);
          final List<UserRecord> items = userRepository.search(term, perPage, offset);
          return new PageResult<>(items, page, perPage, userRepository.countSearch(term));
        },
        result ->
            new UserAction(
                "searched",
                null,
                null,
                Map.of(
                    "query",
                    term,
                    "page",
                    page,
                    "per_page",
                    perPage,
                    "result_count",
                    result.items().size())));
  }

  /** 見つからない場合は空。呼び出し側で 404 へ変換する。 */
  public Optional<UserRecord> findByCode(String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    return userRepository.findByCode(code);
  }

  public Optional<UserRecord> findByEmail(String email) {
    if (email == null || email.isBlank()) {
      return Optional.empty();
    }
    return userRepository.findByEmail(email);
  }

  public Optional<UserRecord> findById(long id) {
    return userRepository.findById(id);
  }

  public UserRecord getById(long id) {
    return userRepository.findById(id).orElseThrow(() -> UserNotFoundException.byId(id));
  }

  public UserRecord create(UserCreateRequest request) {
    ensureUnique(request.email(), request.phone(), null);
    return execute(
        "create",
        "createUser",
        null,
        () -> insertWithGeneratedCode(request),
        user ->
            new UserAction(
                "created",
                user.id(),
                user.email(),
                Map.of("email", user.email(), "name", user.name(), "code", user.code())));
  }

  public UserRecord update(long id, UserUpdateRequest request) {
    final UserRecord current = getById(id);
    ensureUnique(
        changed(request.email(), current.email()),
        changed(request.phone(), current.phone()),
        current.id());
    final Map<String, Object> changes = diff(current, request);
    return execute(
        "update",
        "updateUser",
        id,
        () -> {
          final UserRecord merged =
              current.withProfile(
                  coalesce(request.name(), current.name()),
                  coalesce(request.email(), current.email()),
                  request.password() == null
                      ? current.passwordHash()
                      : passwordEncoder.encode(request.password()),
                  coalesce(request.phone(), current.phone()),
                  coalesce(request.dateOfBirth(), current.dateOfBirth()),
                  request.gender() == null ? current.gender() : Gender.fromValue(request.gender()),
                  coalesce(request.avatar(), current.avatar()),
                  actorResolver.resolve().userId());
          try {
            return userRepository.updateProfile(merged, clock.instant());
          } catch (DuplicateKeyException ex) {
            throw translateConflict(ex);
          }
        },
        user -> new UserAction("updated", user.id(), user.email(), Map.of("changes", changes)));
  }

  /** 論理削除。restore で戻せる。 */
  public UserRecord delete(long id) {
    getById(id);
    return execute(
        "delete",
        "deleteUser",
        id,
        () ->
            userRepository
                .softDelete(id, actorResolver.resolve().userId(), clock.instant())
                .orElseThrow(() -> UserNotFoundException.byId(id)),
        user ->
            new UserAction("deleted", user.id(), user.email(), Map.of("type", "soft_delete")));
  }

  public UserRecord restore(long id) {
    final UserRecord current =
        userRepository.findByIdWithDeleted(id).orElseThrow(() -> UserNotFoundException.byId(id));
    if (!current.isDeleted()) {
      return current;
    }
    return execute(
        "restore",
        "restoreUser",
        id,
        () -> {
          // 削除後に同じ email/phone で別ユーザーが作られている場合は復元できない
          try {
            return userRepository
                .restore(id, actorResolver.resolve().userId(), clock.instant())
                .orElseThrow(() -> UserNotFoundException.byId(id));
          } catch (DuplicateKeyException ex) {
            throw translateConflict(ex);
          }
        },
        user -> new UserAction("restored", user.id(), user.email(), Map.of()));
  }

  /** 物理削除。取り消し不可。 */
  public void forceDelete(long id) {
    final UserRecord current =
        userRepository.findByIdWithDeleted(id).orElseThrow(() -> UserNotFoundException.byId(id));
    execute(
        "force_delete",
        "forceDeleteUser",
        id,
        () -> {
          if (userRepository.forceDelete(id) == 0) {
            throw UserNotFoundException.byId(id);
          }
          return current;
        },
        user ->
            new UserAction(
                "force_deleted", user.id(), user.email(), Map.of("type", "force_delete")));
  }

  public UserRecord lock(long id, long durationSeconds) {
    if (durationSeconds < 1 || durationSeconds > MAX_LOCK_SECONDS) {
      throw new IllegalArgumentException(
          "lock duration must be between 1 and " + MAX_LOCK_SECONDS + " seconds");
    }
    final UserRecord current = getById(id);
    return execute(
        "lock",
        "lockUser",
        id,
        () -> {
          final Instant now = clock.instant();
          return userRepository
              .updateLock(
                  id,
                  now.plusSeconds(durationSeconds),
                  current.lockCount() + 1,
                  actorResolver.resolve().userId(),
                  now)
              .orElseThrow(() -> UserNotFoundException.byId(id));
        },
        user ->
            new UserAction(
                "locked",
                user.id(),
                user.email(),
                Map.of(
                    "duration_seconds",
                    durationSeconds,
                    "locked_until",
                    String.valueOf(user.lockedUntil()),
                    "lock_count",
                    user.lockCount())));
  }

  public UserRecord unlock(long id) {
    getById(id);
    return execute(
        "unlock",
        "unlockUser",
        id,
        () ->
            userRepository
                .updateLock(id, null, 0, actorResolver.resolve().userId(), clock.instant())
                .orElseThrow(() -> UserNotFoundException.byId(id)),
        user -> new UserAction("unlocked", user.id(), user.email(), Map.of()));
  }

  public boolean isLocked(UserRecord user) {
    return user.isLocked(clock.instant());
  }

  public UserRecord enable(long id) {
    return toggleEnabled(id, true);
  }

  public UserRecord disable(long id) {
    return toggleEnabled(id, false);
  }

  public UserStatistics statistics() {
    return execute(
        "statistics",
        "getUserStatistics",
        null,
        () -> userRepository.statistics(clock.instant()),
        stats ->
            new UserAction(
                "statistics_retrieved",
                null,
                null,
                Map.of(
                    "total_users", stats.totalUsers(),
                    "active_users", stats.activeUsers(),
                    "locked_users", stats.lockedUsers())));
  }

  /**
   * 役割:
   * - ID ごとに論理削除を試み、結果を個別に返す。
   *
   * 期待動作:
   * - 1 件の失敗で残りを止めない。
   * - 存在しない ID は failed として数える。
   */
  public BulkOperationResult bulkDelete(List<Long> ids) {
    final List<BulkOperationResult.ItemResult> results = new ArrayList<>();
    int successful = 0;
    int failed = 0;
    for (Long id : ids) {
      try {
        delete(id);
        results.add(new BulkOperationResult.ItemResult(id, true, null));
        successful++;
      } catch (UserNotFoundException ex) {
        results.add(new BulkOperationResult.ItemResult(id, false, "User not found"));
        failed++;
      } catch (RuntimeException ex) {
        logger.warn("bulk delete failed for id={}", id, ex);
        results.add(new BulkOperationResult.ItemResult(id, false, "Delete failed"));
        failed++;
      }
    }
    return new BulkOperationResult(successful, failed, results);
  }

  private UserRecord toggleEnabled(long id, boolean enabled) {
    getById(id);
    return execute(
        enabled ? "enable" : "disable",
        enabled ? "enableUser" : "disableUser",
        id,
        () ->
            userRepository
                .updateEnabled(id, enabled, actorResolver.resolve().userId(), clock.instant())
                .orElseThrow(() -> UserNotFoundException.byId(id)),
        user -> new UserAction(enabled ? "enabled" : "disabled", user.id(), user.email(), Map.of()));
  }

  private UserRecord insertWithGeneratedCode(UserCreateRequest request) {
    try {
      return userRepository.insert(newUser(request));
    } catch (DuplicateKeyException ex) {
      if (!violates(ex, CODE_CONSTRAINT)) {
        throw translateConflict(ex);
      }
      logger.warn("user code collided on insert, regenerating once");
      try {
        return userRepository.insert(newUser(request));
      } catch (DuplicateKeyException retryEx) {
        throw translateConflict(retryEx);
      }
    }
  }

  private UserRecord newUser(UserCreateRequest request) {
    final Instant now = clock.instant();
    final Long actorId = actorResolver.resolve().userId();
    return new UserRecord(
        null,
        userCodeGenerator.generate(userRepository::existsByCode),
        request.name(),
        request.email(),
        passwordEncoder.encode(request.password()),
        request.phone(),
        request.dateOfBirth(),
        Gender.fromValue(request.gender()),
        request.avatar(),
        now,
        request.enabled() == null || request.enabled(),
        null,
        0,
        null,
        actorId,
        actorId,
        null,
        now,
        now);
  }

  private void ensureUnique(String email, String phone, Long excludeId) {
    if (email != null && userRepository.existsByEmail(email, excludeId)) {
      throw new UserConflictException("email", "The email has already been taken.");
    }
    if (phone != null && !phone.isBlank() && userRepository.existsByPhone(phone, excludeId)) {
      throw new UserConflictException("phone", "The phone has already been taken.");
    }
  }

  private RuntimeException translateConflict(DuplicateKeyException ex) {
    if (violates(ex, EMAIL_CONSTRAINT)) {
      return new UserConflictException("email", "The email has already been taken.", ex);
    }
    if (violates(ex, PHONE_CONSTRAINT)) {
      return new UserConflictException("phone", "The phone has already been taken.", ex);
    }
    return ex;
  }

  private static boolean violates(DuplicateKeyException ex, String constraint) {
    final Throwable cause = ex.getMostSpecificCause();
    final String message = cause.getMessage();
    return message != null && message.contains(constraint);
  }

  /** 更新前後の差分。パスワードは値を出さずマーカーのみ記録する。 */
  static Map<String, Object> diff(UserRecord current, UserUpdateRequest request) {
    final Map<String, Object> changes = new LinkedHashMap<>();
    putChange(changes, "name", current.name(), request.name());
    putChange(changes, "email", current.email(), request.email());
    putChange(changes, "phone", current.phone(), request.phone());
    putChange(changes, "date_of_birth", current.dateOfBirth(), request.dateOfBirth());
    putChange(
        changes,
        "gender",
        current.gender() == null ? null : current.gender().value(),
        request.gender());
    putChange(changes, "avatar", current.avatar(), request.avatar());
    if (request.password() != null) {
      changes.put("password", PASSWORD_CHANGE_MARKER);
    }
    return changes;
  }

  private static void putChange(
      Map<String, Object> changes, String field, Object before, Object after) {
    if (after == null || Objects.equals(before, after)) {
      return;
    }
    final Map<String, Object> change = new LinkedHashMap<>();
    change.put("from", before == null ? null : String.valueOf(before));
    change.put("to", String.valueOf(after));
    changes.put(field, change);
  }

  private static String changed(String requested, String current) {
    return requested == null || requested.equalsIgnoreCase(String.valueOf(current))
        ? null
        : requested;
  }

  private static <T> T coalesce(T value, T fallback) {
    return value != null ? value : fallback;
  }

  /**
   * 役割:
   * - 永続化操作を計測し、成功/失敗を監査ログへ記録する。
   *
   * 期待動作:
   * - 成功時は database チャネルと user_action チャネルへ記録する。
   * - 失敗時はエラー付きの database 記録とサービスエラー記録を残し、例外はそのまま再送出する。
   * - UserNotFoundException はサービスエラーとして記録しない。
   */
  private <T> T execute(
      String operation,
      String method,
      Long entityId,
      Supplier<T> action,
      Function<T, UserAction> describe) {
    final long startedAt = System.nanoTime();
    final T result;
    try {
      result = action.get();
    } catch (RuntimeException ex) {
      final Duration duration = Duration.ofNanos(System.nanoTime() - startedAt);
      auditLogger.logDatabaseOperation(
          operation, ENTITY_TYPE, entityId, duration, Map.of(), true, ex.getMessage());
      if (ex instanceof UserNotFoundException) {
        throw ex;
      }
      final Map<String, Object> context = new LinkedHashMap<>();
      context.put("entity_id", entityId);
      context.put("duration_ms", durationMillis(duration));
      auditLogger.logServiceError(SERVICE_NAME, method, ex, context);
      throw ex;
    }
    final Duration duration = Duration.ofNanos(System.nanoTime() - startedAt);
    final UserAction userAction = describe.apply(result);
    final Long loggedId = userAction.userId() != null ? userAction.userId() : entityId;
    auditLogger.logDatabaseOperation(operation, ENTITY_TYPE, loggedId, duration, Map.of());
    final Map<String, Object> data = new LinkedHashMap<>(userAction.data());
    data.put("duration_ms", durationMillis(duration));
    auditLogger.logUserAction(userAction.action(), userAction.userId(), userAction.email(), data);
    return result;
  }

  private static double durationMillis(Duration duration) {
    return Math.round(duration.toNanos() / 10_000d) / 100d;
  }

  private record UserAction(String action, Long userId, String email, Map<String, ?> data) {}
}
