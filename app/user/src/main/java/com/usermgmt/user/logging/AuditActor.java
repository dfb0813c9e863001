package com.usermgmt.user.logging;

public record AuditActor(Long userId, String name, String ipAddress, String userAgent) {

  public static final String SYSTEM = "system";
  public static final String UNKNOWN = "unknown";

  public static AuditActor system() {
    return new AuditActor(null, SYSTEM, UNKNOWN, UNKNOWN);
  }
}
