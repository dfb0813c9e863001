/*
 * どこで: User API 共通フィルタ
 * 何を: リクエストごとの correlation id を確定し、MDC/リクエスト属性/応答ヘッダーへ設定する
 * なぜ: 1 リクエスト内のログと応答を突き合わせられるようにするため
 */
package com.usermgmt.user.config;

import com.usermgmt.common.CorrelationIds;
import com.usermgmt.user.logging.AuditContextKeys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String correlationId = resolve(request);
    request.setAttribute(AuditContextKeys.CORRELATION_ID_ATTRIBUTE, correlationId);
    // ヘッダーはコミット前に設定する
    response.setHeader(AuditContextKeys.CORRELATION_ID_HEADER, correlationId);
    MDC.put(AuditContextKeys.MDC_CORRELATION_ID, correlationId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(AuditContextKeys.MDC_CORRELATION_ID);
    }
  }

  /** 受信ヘッダーがあればそのまま使い、なければ新規発行する。 */
  static String resolve(HttpServletRequest request) {
    final String inbound = request.getHeader(AuditContextKeys.CORRELATION_ID_HEADER);
    if (inbound != null && !inbound.isBlank()) {
      return inbound;
    }
    return CorrelationIds.newCorrelationId();
  }
}
