package com.usermgmt.user.logging;

public enum AuditChannel {
  API("audit.api"),
  DATABASE("audit.database"),
  PERFORMANCE("audit.performance"),
  SERVICE_ERRORS("audit.service_errors"),
  AUTH("audit.auth"),
  USER_ACTION("audit.user_action"),
  FALLBACK("audit.fallback");

  private final String loggerName;

  AuditChannel(String loggerName) {
    this.loggerName = loggerName;
  }

  public String loggerName() {
    return loggerName;
  }
}
