package com.usermgmt.user.logging;

import java.util.Map;

/** Inbound request as seen by the request-logging filter, before redaction. */
public record HttpRequestSnapshot(
    String method,
    String path,
    Map<String, Object> headers,
    Map<String, Object> query,
    Object body,
    String handler,
    String ipAddress,
    String userAgent) {

  public HttpRequestSnapshot {
    headers = headers == null ? Map.of() : headers;
    query = query == null ? Map.of() : query;
  }
}
