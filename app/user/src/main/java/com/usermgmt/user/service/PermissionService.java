/*
 * どこで: 権限判定
 * 何を: permissions テーブルとゲートウェイ転送ロールから操作可否を判定する
 * なぜ: 取り消し不能な操作 (物理削除) を明示的な権限付与がある利用者に限定するため
 */
package com.usermgmt.user.service;

import com.usermgmt.user.repository.PermissionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PermissionService implements PermissionChecker {

  static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

  private final PermissionRepository permissionRepository;

  public enum Decision {
    ALLOWED,
    UNAUTHENTICATED,
    FORBIDDEN
  }

  @Override
  public boolean hasPermission(long userId, String resource, String action, Long resourceId) {
    return permissionRepository.exists(userId, resource, action, resourceId);
  }

  /**
   * 役割:
   * - 認証済み主体が resource:action を実行できるか判定する。
   *
   * 期待動作:
   * - 主体なし/匿名は UNAUTHENTICATED。
   * - ADMIN ロールは常に ALLOWED。
   * - 主体名が数値のユーザー ID でない場合は FORBIDDEN。
   */
  public Decision authorize(
      Authentication authentication, String resource, String action, Long resourceId) {
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return Decision.UNAUTHENTICATED;
    }
    final boolean admin =
        authentication.getAuthorities().stream()
            .anyMatch(authority -> ADMIN_AUTHORITY.equals(authority.getAuthority()));
    if (admin) {
      return Decision.ALLOWED;
    }
    final long userId;
    try {
      userId = Long.parseLong(authentication.getName());
    } catch (NumberFormatException ex) {
      return Decision.FORBIDDEN;
    }
    return hasPermission(userId, resource, action, resourceId)
        ? Decision.ALLOWED
        : Decision.FORBIDDEN;
  }
}
