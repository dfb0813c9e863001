package com.usermgmt.user.api.response;

import com.usermgmt.user.config.UserApiProperties;
import com.usermgmt.user.logging.AuditLogger;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/** Hands out one {@link ApiResponder} per handler invocation so builder state never crosses requests. */
@Component
@RequiredArgsConstructor
public class ApiResponderFactory {

  private final UserApiProperties properties;
  private final AuditLogger auditLogger;
  private final Clock clock;

  public ApiResponder create(HttpServletRequest request) {
    return new ApiResponder(properties, auditLogger, clock, request, currentResponse());
  }

  public ApiResponder create() {
    if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
      return new ApiResponder(
          properties, auditLogger, clock, attrs.getRequest(), attrs.getResponse());
    }
    return new ApiResponder(properties, auditLogger, clock, null, null);
  }

  private static HttpServletResponse currentResponse() {
    if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attrs) {
      return attrs.getResponse();
    }
    return null;
  }
}
