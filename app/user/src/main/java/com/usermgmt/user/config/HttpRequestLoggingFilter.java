/*
 * どこで: User API 共通フィルタ
 * 何を: 受信リクエストと結果 (ステータス/所要時間) を監査ログと API チャネルへ記録する
 * なぜ: 全 API 呼び出しを機密値マスク済みで追跡できるようにするため
 */
package com.usermgmt.user.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.usermgmt.user.logging.AuditActorResolver;
import com.usermgmt.user.logging.AuditContextKeys;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.logging.HttpRequestSnapshot;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

@Component
@Order(SecurityProperties.DEFAULT_FILTER_ORDER + 1)
@RequiredArgsConstructor
public class HttpRequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(HttpRequestLoggingFilter.class);
  private static final int MAX_BODY_BYTES = 64 * 1024;

  private final AuditLogger auditLogger;
  private final ObjectMapper objectMapper;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/actuator");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final ContentCachingRequestWrapper wrapped =
        new ContentCachingRequestWrapper(request, MAX_BODY_BYTES);
    final long startedAt = System.nanoTime();
    RuntimeException failure = null;
    try {
      filterChain.doFilter(wrapped, response);
    } catch (RuntimeException ex) {
      failure = ex;
      throw ex;
    } finally {
      final Duration duration = Duration.ofNanos(System.nanoTime() - startedAt);
      final int status =
          failure != null ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR : response.getStatus();
      final HttpRequestSnapshot snapshot = snapshot(wrapped);
      final boolean error = failure != null || status >= 400;
      auditLogger.logHttpRequest(
          snapshot, status, duration, error, failure != null ? failure.getMessage() : null);
      auditLogger.logApiRequest(snapshot, status, duration);
    }
  }

  HttpRequestSnapshot snapshot(ContentCachingRequestWrapper request) {
    final Object handler = request.getAttribute(AuditContextKeys.HANDLER_ATTRIBUTE);
    return new HttpRequestSnapshot(
        request.getMethod(),
        request.getRequestURI(),
        headers(request),
        query(request),
        body(request),
        handler instanceof String name ? name : null,
        AuditActorResolver.resolveClientIp(request),
        request.getHeader("User-Agent"));
  }

  private static Map<String, Object> headers(HttpServletRequest request) {
    final Map<String, Object> headers = new LinkedHashMap<>();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.put(
          name.toLowerCase(Locale.ROOT),
          String.join(",", Collections.list(request.getHeaders(name))));
    }
    return headers;
  }

  private static Map<String, Object> query(HttpServletRequest request) {
    final Map<String, Object> query = new LinkedHashMap<>();
    request
        .getParameterMap()
        .forEach(
            (name, values) ->
                query.put(name, values.length == 1 ? values[0] : List.of(values)));
    return query;
  }

  private Object body(ContentCachingRequestWrapper request) {
    final byte[] content = request.getContentAsByteArray();
    if (content.length == 0) {
      return Map.of();
    }
    final String contentType = request.getContentType();
    if (contentType != null && contentType.contains(MediaType.APPLICATION_JSON_VALUE)) {
      try {
        return objectMapper.readValue(content, Object.class);
      } catch (IOException ex) {
        logger.debug("request body is not valid JSON, logging as text", ex);
      }
    }
    return new String(content, StandardCharsets.UTF_8);
  }
}
