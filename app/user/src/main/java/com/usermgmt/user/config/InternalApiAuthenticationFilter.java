package com.usermgmt.user.config;

import com.usermgmt.user.logging.AuditLogger;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Establishes the caller identity forwarded by the trusted gateway.
 *
 * <p>A principal is set only when the shared internal token matches and a user id header is
 * present. Requests without the token continue anonymously.
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String ROLE_PREFIX = "ROLE_";

  private final InternalApiProperties properties;
  private final AuditLogger auditLogger;

  public InternalApiAuthenticationFilter(
      InternalApiProperties properties, AuditLogger auditLogger) {
    this.properties = properties;
    this.auditLogger = auditLogger;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String actualToken = request.getHeader(properties.headerName());
    if (actualToken != null && !isValidInternalToken(actualToken)) {
      logger.warn("internal token rejected on path={}", request.getRequestURI());
      auditLogger.logAuthEvent(
          "internal_token_rejected", null, Map.of("path", request.getRequestURI()));
    } else if (actualToken != null) {
      final UsernamePasswordAuthenticationToken authentication = resolveAuthentication(request);
      if (authentication != null) {
        logger.debug(
            "internal authentication established for path={} authorities={}",
            request.getRequestURI(),
            authentication.getAuthorities());
        SecurityContextHolder.getContext().setAuthentication(authentication);
      } else {
        auditLogger.logAuthEvent(
            "forwarded_identity_missing", null, Map.of("path", request.getRequestURI()));
      }
    }
    filterChain.doFilter(request, response);
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    if (forwardedUserId == null || forwardedUserId.isBlank()) {
      return null;
    }
    return new UsernamePasswordAuthenticationToken(
        forwardedUserId.trim(),
        "N/A",
        buildAuthorities(request.getHeader(properties.userRolesHeaderName())));
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && actualToken.equals(properties.token())
        && !properties.token().isBlank();
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedRoles) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(INTERNAL_ROLE));

    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }

    for (String role : forwardedRoles.split(",")) {
      final String normalized = role == null ? "" : role.trim().toUpperCase(Locale.ROOT);
      if (normalized.isEmpty()) {
        continue;
      }
      final String authority =
          normalized.startsWith(ROLE_PREFIX) ? normalized : ROLE_PREFIX + normalized;
      authorities.add(new SimpleGrantedAuthority(authority));
    }
    return authorities;
  }
}
