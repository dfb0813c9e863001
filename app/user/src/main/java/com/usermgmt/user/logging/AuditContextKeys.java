package com.usermgmt.user.logging;

/** MDC keys and request attribute names shared by the request filters and the audit logger. */
public final class AuditContextKeys {

  public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
  public static final String REQUEST_ID_HEADER = "X-Request-ID";

  public static final String MDC_CORRELATION_ID = "correlation_id";
  public static final String MDC_REQUEST_ID = "request_id";
  public static final String MDC_HANDLER = "handler";

  public static final String CORRELATION_ID_ATTRIBUTE =
      AuditContextKeys.class.getName() + ".CORRELATION_ID";
  public static final String HANDLER_ATTRIBUTE = AuditContextKeys.class.getName() + ".HANDLER";

  private AuditContextKeys() {}
}
