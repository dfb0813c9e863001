/*
 * どこで: User API セキュリティフィルタ
 * 何を: 転送 ID の利用者が無効化またはロック中なら 403 で打ち切る
 * なぜ: 権限判定より前に、停止済みアカウントからの操作をすべて止めるため
 */
package com.usermgmt.user.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.api.response.ResponseEnvelope;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.model.UserRecord;
import com.usermgmt.user.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 役割:
 * - {@link InternalApiAuthenticationFilter} が確立した利用者を DB から引き直し、稼働状態を確認する。
 *
 * 期待動作:
 * - enabled=false なら 403 "Your account has been disabled" を返す。
 * - locked_at が現在より未来なら 403 "Your account is locked" を返す。
 * - 匿名・数値でない ID・該当なし (削除済み含む) はそのまま後続へ流す。
 */
public class ActiveUserFilter extends OncePerRequestFilter {

  static final String DISABLED_MESSAGE = "Your account has been disabled";
  static final String LOCKED_MESSAGE = "Your account is locked";

  private static final Logger logger = LoggerFactory.getLogger(ActiveUserFilter.class);

  private final UserRepository userRepository;
  private final ApiResponderFactory responderFactory;
  private final AuditLogger auditLogger;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ActiveUserFilter(
      UserRepository userRepository,
      ApiResponderFactory responderFactory,
      AuditLogger auditLogger,
      ObjectMapper objectMapper,
      Clock clock) {
    this.userRepository = userRepository;
    this.responderFactory = responderFactory;
    this.auditLogger = auditLogger;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final Long userId = forwardedUserId();
    final Optional<UserRecord> user =
        userId == null ? Optional.empty() : userRepository.findById(userId);
    final String reason = user.map(this::inactiveReason).orElse(null);
    if (reason == null) {
      filterChain.doFilter(request, response);
      return;
    }

    logger.warn("inactive user rejected userId={} reason={}", userId, reason);
    auditLogger.logAuthEvent(
        "inactive_user_rejected",
        userId,
        Map.of("reason", reason, "path", request.getRequestURI()));
    SecurityContextHolder.clearContext();
    final String message = "disabled".equals(reason) ? DISABLED_MESSAGE : LOCKED_MESSAGE;
    write(
        response,
        responderFactory.create(request).withRequestCorrelationId().forbidden(message, reason));
  }

  private Long forwardedUserId() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof UsernamePasswordAuthenticationToken)
        || !authentication.isAuthenticated()) {
      return null;
    }
    try {
      return Long.valueOf(authentication.getName());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private String inactiveReason(UserRecord user) {
    if (!user.enabled()) {
      return "disabled";
    }
    if (user.isLocked(Instant.now(clock))) {
      return "locked";
    }
    return null;
  }

  private void write(HttpServletResponse response, ResponseEntity<ResponseEnvelope> entity)
      throws IOException {
    response.setStatus(entity.getStatusCode().value());
    entity.getHeaders().forEach((name, values) -> response.setHeader(name, values.get(0)));
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), entity.getBody());
  }
}
