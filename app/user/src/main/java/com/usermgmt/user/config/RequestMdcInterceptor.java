package com.usermgmt.user.config;

import com.usermgmt.user.logging.AuditActorResolver;
import com.usermgmt.user.logging.AuditContextKeys;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String handlerName = resolveHandlerName(handler);
    if (handlerName != null) {
      request.setAttribute(AuditContextKeys.HANDLER_ATTRIBUTE, handlerName);
    }
    final List<String> keys = new ArrayList<>();
    put(keys, AuditContextKeys.MDC_REQUEST_ID, resolveRequestId(request));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", AuditActorResolver.resolveClientIp(request));
    put(keys, "user_id", resolveUserId());
    put(keys, AuditContextKeys.MDC_HANDLER, handlerName);
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  /** "UserController@store" 形式。 */
  static String resolveHandlerName(Object handler) {
    if (handler instanceof HandlerMethod handlerMethod) {
      return handlerMethod.getBeanType().getSimpleName() + "@" + handlerMethod.getMethod().getName();
    }
    return null;
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(AuditContextKeys.REQUEST_ID_HEADER);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }

  private String resolveUserId() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null && authentication.isAuthenticated()) {
      final String name = authentication.getName();
      if (name != null && !name.isBlank() && !"anonymousUser".equals(name)) {
        return name;
      }
    }
    return null;
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
