package com.usermgmt.user.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "user-api.internal-api")
public record InternalApiProperties(
    String headerName, String token, String userIdHeaderName, String userRolesHeaderName) {

  public InternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    userRolesHeaderName =
        userRolesHeaderName == null || userRolesHeaderName.isBlank()
            ? "X-User-Roles"
            : userRolesHeaderName;
  }
}
