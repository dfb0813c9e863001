/*
 * どこで: app/user/src/main/java/com/usermgmt/user/api/UserController.java
 * 何を: ユーザー管理 API (一覧/検索/統計/作成/参照/更新/削除/復元/ロック/有効化/一括削除)
 * なぜ: 業務処理を UserService に委ね、HTTP 契約と応答エンベロープの組み立てだけを担うため
 */
package com.usermgmt.user.api;

import com.usermgmt.user.api.request.BulkDeleteRequest;
import com.usermgmt.user.api.request.UserCreateRequest;
import com.usermgmt.user.api.request.UserUpdateRequest;
import com.usermgmt.user.api.response.ApiResponder;
import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.api.response.ResponseEnvelope;
import com.usermgmt.user.api.response.UserResponse;
import com.usermgmt.user.config.UserApiProperties;
import com.usermgmt.user.model.PageResult;
import com.usermgmt.user.model.UserRecord;
import com.usermgmt.user.model.UserStatistics;
import com.usermgmt.user.service.BulkOperationResult;
import com.usermgmt.user.service.PermissionService;
import com.usermgmt.user.service.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

  static final String FORCE_DELETE_RESOURCE = "users";
  static final String FORCE_DELETE_ACTION = "force_delete";
  static final String PASSWORD_MISMATCH = "The password confirmation does not match.";

  private final UserService userService;
  private final PermissionService permissionService;
  private final ApiResponderFactory responders;
  private final UserApiProperties properties;
  private final Clock clock;

  /**
   * 役割:
   * - 論理削除されていないユーザーを作成日時の降順でページング返却する。
   *
   * 期待動作:
   * - search 指定時は name/email/phone の部分一致で絞り込む。
   * - per_page は上限で切り詰める。
   */
  @GetMapping
  public ResponseEntity<ResponseEnvelope> index(
      @RequestParam(name = "page", required = false) Integer page,
      @RequestParam(name = "per_page", required = false) Integer perPage,
      @RequestParam(name = "search", required = false) String search) {
    final int resolvedPage = properties.pagination().resolvePage(page);
    final int resolvedPerPage = properties.pagination().resolvePerPage(perPage);
    final PageResult<UserRecord> result =
        search == null || search.isBlank()
            ? userService.list(resolvedPage, resolvedPerPage)
            : userService.search(search, resolvedPage, resolvedPerPage);
    final Instant now = clock.instant();
    return responder()
        .paginated(
            result.map(user -> UserResponse.from(user, now)), "Users retrieved successfully");
  }

  @GetMapping("/search")
  public ResponseEntity<ResponseEnvelope> search(
      @RequestParam(name = "q", required = false) String query) {
    if (query == null || query.isBlank()) {
      return responder().validationError(Map.of("q", List.of("The q field is required.")));
    }
    final int limit = properties.pagination().maxPerPage();
    final Instant now = clock.instant();
    final List<UserResponse> items =
        userService.search(query, 1, limit).items().stream()
            .map(user -> UserResponse.from(user, now))
            .toList();
    return responder().collection(items, "Search results retrieved successfully");
  }

  @GetMapping("/stats")
  public ResponseEntity<ResponseEnvelope> stats() {
    final UserStatistics stats = userService.statistics();
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("total_users", stats.totalUsers());
    data.put("active_users", stats.activeUsers());
    data.put("disabled_users", stats.disabledUsers());
    data.put("locked_users", stats.lockedUsers());
    data.put("verified_users", stats.verifiedUsers());
    final Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("generated_at", clock.instant().toString());
    meta.put("cached", false);
    meta.put("cache_ttl", 0);
    return responder().withMeta(meta).success(data, "User statistics retrieved successfully");
  }

  /**
   * 役割:
   * - ユーザーを作成し、Location と関連操作のリンクを付けて 201 を返す。
   *
   * 期待動作:
   * - password_confirmation 不一致は 422 (field=password)。
   * - email/phone 重複は 409。
   */
  @PostMapping
  public ResponseEntity<ResponseEnvelope> store(@Valid @RequestBody UserCreateRequest request) {
    if (!request.passwordConfirmed()) {
      return responder().validationError(Map.of("password", List.of(PASSWORD_MISMATCH)));
    }
    final UserRecord user = userService.create(request);
    final URI location = userUri("/users/{code}", user.code());
    final Map<String, Object> links = new LinkedHashMap<>();
    links.put("self", location.toString());
    links.put("update", userUri("/users/{id}", user.id()).toString());
    links.put("delete", userUri("/users/{id}", user.id()).toString());
    return responder()
        .withLinks(links)
        .created(UserResponse.from(user, clock.instant()), "User created successfully", location);
  }

  @GetMapping("/{code}")
  public ResponseEntity<ResponseEnvelope> show(@PathVariable("code") String code) {
    return userService
        .findByCode(code)
        .map(
            user ->
                responder()
                    .success(
                        UserResponse.from(user, clock.instant()), "User retrieved successfully"))
        .orElseGet(() -> responder().notFound(null, "User"));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ResponseEnvelope> update(
      @PathVariable("id") long id, @Valid @RequestBody UserUpdateRequest request) {
    if (!request.passwordConfirmed()) {
      return responder().validationError(Map.of("password", List.of(PASSWORD_MISMATCH)));
    }
    final UserRecord user = userService.update(id, request);
    return responder()
        .success(UserResponse.from(user, clock.instant()), "User updated successfully");
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<ResponseEnvelope> destroy(@PathVariable("id") long id) {
    userService.delete(id);
    return responder().success(Map.of("deleted", true), "User deleted successfully");
  }

  /** 取り消し不能なため users:force_delete 権限 (または ADMIN) を要求する。 */
  @DeleteMapping("/{id}/force")
  public ResponseEntity<ResponseEnvelope> forceDelete(@PathVariable("id") long id) {
    final PermissionService.Decision decision =
        permissionService.authorize(
            SecurityContextHolder.getContext().getAuthentication(),
            FORCE_DELETE_RESOURCE,
            FORCE_DELETE_ACTION,
            id);
    if (decision == PermissionService.Decision.UNAUTHENTICATED) {
      return responder().unauthorized("Unauthenticated", "user-api");
    }
    if (decision == PermissionService.Decision.FORBIDDEN) {
      return responder()
          .forbidden(
              "You do not have permission to permanently delete users",
              "missing permission " + FORCE_DELETE_RESOURCE + ":" + FORCE_DELETE_ACTION);
    }
    userService.forceDelete(id);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("deleted", true);
    data.put("permanent", true);
    return responder().success(data, "User permanently deleted");
  }

  @PostMapping("/{id}/restore")
  public ResponseEntity<ResponseEnvelope> restore(@PathVariable("id") long id) {
    final UserRecord user = userService.restore(id);
    return responder()
        .success(UserResponse.from(user, clock.instant()), "User restored successfully");
  }

  @PostMapping("/{id}/enable")
  public ResponseEntity<ResponseEnvelope> enable(@PathVariable("id") long id) {
    final UserRecord user = userService.enable(id);
    return responder()
        .success(UserResponse.from(user, clock.instant()), "User enabled successfully");
  }

  @PostMapping("/{id}/disable")
  public ResponseEntity<ResponseEnvelope> disable(@PathVariable("id") long id) {
    final UserRecord user = userService.disable(id);
    return responder()
        .success(UserResponse.from(user, clock.instant()), "User disabled successfully");
  }

  @PostMapping("/{id}/lock")
  public ResponseEntity<ResponseEnvelope> lock(
      @PathVariable("id") long id,
      @RequestParam(name = "seconds", defaultValue = "3600") @Min(1) @Max(31_536_000)
          long seconds) {
    final UserRecord user = userService.lock(id, seconds);
    return responder().success(lockState(user), "User locked successfully");
  }

  @PostMapping("/{id}/unlock")
  public ResponseEntity<ResponseEnvelope> unlock(@PathVariable("id") long id) {
    final UserRecord user = userService.unlock(id);
    return responder().success(lockState(user), "User unlocked successfully");
  }

  @PostMapping("/bulk-delete")
  public ResponseEntity<ResponseEnvelope> bulkDelete(
      @Valid @RequestBody BulkDeleteRequest request) {
    final BulkOperationResult result = userService.bulkDelete(request.ids());
    return responder()
        .bulkOperation(result.successful(), result.failed(), result.results(), "delete");
  }

  private Map<String, Object> lockState(UserRecord user) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("user", UserResponse.from(user, clock.instant()));
    data.put("is_locked", userService.isLocked(user));
    data.put("locked_until", user.lockedUntil() == null ? null : user.lockedUntil().toString());
    data.put("lock_count", user.lockCount());
    return data;
  }

  private ApiResponder responder() {
    return responders.create().withRequestCorrelationId();
  }

  private static URI userUri(String path, Object value) {
    return ServletUriComponentsBuilder.fromCurrentContextPath()
        .path(path)
        .buildAndExpand(value)
        .toUri();
  }
}
