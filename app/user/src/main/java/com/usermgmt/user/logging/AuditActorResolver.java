/*
 * どこで: 監査ログ
 * 何を: 現在のリクエストと SecurityContext から実行者/IP/UA を解決する
 * なぜ: ロガー呼び出し側へ実行者情報の受け渡しを強制しないため
 */
package com.usermgmt.user.logging;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

@Component
public class AuditActorResolver {

  private static final String ANONYMOUS = "anonymousUser";

  public AuditActor resolve() {
    final HttpServletRequest request = currentRequest();
    final String ip = request == null ? AuditActor.UNKNOWN : resolveClientIp(request);
    final String userAgent =
        request == null ? AuditActor.UNKNOWN : orUnknown(request.getHeader("User-Agent"));
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication.getName() == null
        || ANONYMOUS.equals(authentication.getName())) {
      return new AuditActor(null, AuditActor.SYSTEM, ip, userAgent);
    }
    final String name = authentication.getName();
    return new AuditActor(parseUserId(name), name, ip, userAgent);
  }

  public static String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return orUnknown(request.getRemoteAddr());
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }

  private static HttpServletRequest currentRequest() {
    if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
      return attrs.getRequest();
    }
    return null;
  }

  private static Long parseUserId(String name) {
    try {
      return Long.valueOf(name);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static String orUnknown(String value) {
    return value == null || value.isBlank() ? AuditActor.UNKNOWN : value;
  }
}
