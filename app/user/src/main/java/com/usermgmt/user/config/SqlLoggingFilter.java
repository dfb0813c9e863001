package com.usermgmt.user.config;

import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.logging.SqlStatementCollector;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Buffers every statement issued while handling the request and writes them as one batch. */
@Component
@Order(SecurityProperties.DEFAULT_FILTER_ORDER + 2)
@RequiredArgsConstructor
public class SqlLoggingFilter extends OncePerRequestFilter {

  private final SqlStatementCollector sqlStatementCollector;
  private final AuditLogger auditLogger;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    sqlStatementCollector.begin();
    try {
      filterChain.doFilter(request, response);
    } finally {
      auditLogger.logSqlBatch(sqlStatementCollector.drain());
    }
  }
}
