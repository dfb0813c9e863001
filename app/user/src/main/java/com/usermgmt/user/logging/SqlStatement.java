package com.usermgmt.user.logging;

import java.time.Duration;
import java.util.Map;

/**
 * One SQL execution to be written to the audit store.
 *
 * <p>{@code operation} and {@code module} may be null; the logger then detects the operation from
 * the statement text and attributes the module from the call stack.
 */
public record SqlStatement(
    String sql,
    Map<String, Object> params,
    SqlOperation operation,
    Duration duration,
    String module,
    boolean error,
    String message) {

  public SqlStatement {
    params = params == null ? Map.of() : params;
    duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
  }

  public static SqlStatement of(String sql, Map<String, Object> params, Duration duration) {
    return new SqlStatement(sql, params, null, duration, null, false, null);
  }

  public SqlStatement withModule(String resolvedModule) {
    return new SqlStatement(sql, params, operation, duration, resolvedModule, error, message);
  }
}
