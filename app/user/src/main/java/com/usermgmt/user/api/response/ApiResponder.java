/*
 * どこで: User API 応答
 * 何を: ResponseEnvelope を組み立てる fluent ビルダー
 * なぜ: 応答種別 (成功/エラー/ページング/一括操作/部分取得など) ごとの形とヘッダーを一箇所で保証するため
 */
package com.usermgmt.user.api.response;

import com.usermgmt.user.config.UserApiProperties;
import com.usermgmt.user.logging.AuditContextKeys;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.model.PageResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 役割:
 * - 設定メソッド (correlation id/links/meta/debug) を積み上げ、終端メソッドで 1 件の応答を返す。
 *
 * 期待動作:
 * - 終端メソッドを呼ぶたびに設定状態を破棄し、次の応答へ持ち越さない。
 * - production では debug を一切出力しない。
 * - 1 リクエスト (ハンドラ呼び出し) につき 1 インスタンスを {@link ApiResponderFactory} から取得する。
 */
public class ApiResponder {

  static final String CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
  static final String FRAME_OPTIONS = "X-Frame-Options";
  static final String XSS_PROTECTION = "X-XSS-Protection";

  private final UserApiProperties properties;
  private final AuditLogger auditLogger;
  private final Clock clock;
  private final HttpServletRequest request;
  private final HttpServletResponse response;

  private String correlationId;
  private Map<String, Object> links;
  private Map<String, Object> meta;
  private Map<String, Object> debug;

  ApiResponder(
      UserApiProperties properties,
      AuditLogger auditLogger,
      Clock clock,
      HttpServletRequest request) {
    this(properties, auditLogger, clock, request, null);
  }

  ApiResponder(
      UserApiProperties properties,
      AuditLogger auditLogger,
      Clock clock,
      HttpServletRequest request,
      HttpServletResponse response) {
    this.properties = properties;
    this.auditLogger = auditLogger;
    this.clock = clock;
    this.request = request;
    this.response = response;
  }

  public ApiResponder setCorrelationId(String correlationId) {
    this.correlationId = correlationId;
    return this;
  }

  /** フィルタがリクエストへ設定した correlation id を採用する。 */
  public ApiResponder withRequestCorrelationId() {
    if (request != null
        && request.getAttribute(AuditContextKeys.CORRELATION_ID_ATTRIBUTE) instanceof String id) {
      this.correlationId = id;
    }
    return this;
  }

  public ApiResponder withDebug(Map<String, ?> values) {
    if (properties.isProduction() || values == null) {
      return this;
    }
    debug().putAll(values);
    return this;
  }

  public ApiResponder withLinks(Map<String, ?> values) {
    if (values != null) {
      links().putAll(values);
    }
    return this;
  }

  public ApiResponder withMeta(Map<String, ?> values) {
    if (values != null) {
      meta().putAll(values);
    }
    return this;
  }

  public ResponseEntity<ResponseEnvelope> success(Object data) {
    return success(data, "Success", HttpStatus.OK);
  }

  public ResponseEntity<ResponseEnvelope> success(Object data, String message) {
    return success(data, message, HttpStatus.OK);
  }

  public ResponseEntity<ResponseEnvelope> success(Object data, String message, HttpStatus status) {
    return emit(true, status, message, data, null, new HttpHeaders());
  }

  public ResponseEntity<ResponseEnvelope> error(String message, HttpStatus status) {
    return error(message, status, null, null);
  }

  /** 例外が渡された場合はサービスエラーとして記録してから応答を組み立てる。 */
  public ResponseEntity<ResponseEnvelope> error(
      String message, HttpStatus status, Object errors, Throwable exception) {
    if (exception != null) {
      recordException(exception, status);
    }
    return emit(false, status, message, null, errors, new HttpHeaders());
  }

  public ResponseEntity<ResponseEnvelope> created(Object data, String message, URI location) {
    final HttpHeaders headers = new HttpHeaders();
    if (location != null) {
      headers.setLocation(location);
    }
    return emit(
        true,
        HttpStatus.CREATED,
        message == null ? "Created successfully" : message,
        data,
        null,
        headers);
  }

  public ResponseEntity<ResponseEnvelope> accepted(Object data, String message) {
    return success(data, message == null ? "Accepted" : message, HttpStatus.ACCEPTED);
  }

  public ResponseEntity<ResponseEnvelope> noContent() {
    try {
      return ResponseEntity.noContent().headers(securityHeaders()).build();
    } finally {
      reset();
    }
  }

  public ResponseEntity<ResponseEnvelope> notFound(String message, String resourceType) {
    final String resolved =
        resourceType != null
            ? resourceType + " not found"
            : (message == null ? "Resource not found" : message);
    return error(resolved, HttpStatus.NOT_FOUND);
  }

  public ResponseEntity<ResponseEnvelope> validationError(Object errors) {
    return validationError(errors, "Validation failed");
  }

  public ResponseEntity<ResponseEnvelope> validationError(Object errors, String message) {
    return emit(
        false,
        HttpStatus.UNPROCESSABLE_ENTITY,
        message == null ? "Validation failed" : message,
        null,
        errors,
        new HttpHeaders());
  }

  public ResponseEntity<ResponseEnvelope> unauthorized(String message, String realm) {
    final HttpHeaders headers = new HttpHeaders();
    if (realm != null) {
      headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"" + realm + "\"");
    }
    return emit(
        false,
        HttpStatus.UNAUTHORIZED,
        message == null ? "Unauthorized" : message,
        null,
        null,
        headers);
  }

  public ResponseEntity<ResponseEnvelope> forbidden(String message, String reason) {
    if (reason != null) {
      meta().put("reason", reason);
    }
    return error(message == null ? "Forbidden" : message, HttpStatus.FORBIDDEN);
  }

  public ResponseEntity<ResponseEnvelope> serverError(String message, Throwable exception) {
    return error(
        message == null ? "Internal server error" : message,
        HttpStatus.INTERNAL_SERVER_ERROR,
        null,
        exception);
  }

  public ResponseEntity<ResponseEnvelope> conflict(String message, Object conflicts) {
    return error(message == null ? "Conflict" : message, HttpStatus.CONFLICT, conflicts, null);
  }

  public ResponseEntity<ResponseEnvelope> tooManyRequests(
      String message, Integer retryAfterSeconds) {
    final HttpHeaders headers = new HttpHeaders();
    if (retryAfterSeconds != null) {
      headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
      meta().put("retry_after", retryAfterSeconds);
    }
    return emit(
        false,
        HttpStatus.TOO_MANY_REQUESTS,
        message == null ? "Too many requests" : message,
        null,
        null,
        headers);
  }

  public ResponseEntity<ResponseEnvelope> paginated(PageResult<?> page, String message) {
    return paginated(page, message, true);
  }

  public ResponseEntity<ResponseEnvelope> paginated(
      PageResult<?> page, String message, boolean withLinks) {
    final Map<String, Object> pagination = new LinkedHashMap<>();
    pagination.put("current_page", page.page());
    pagination.put("per_page", page.perPage());
    pagination.put("total", page.total());
    pagination.put("last_page", page.lastPage());
    pagination.put("from", page.from());
    pagination.put("to", page.to());
    pagination.put("has_more_pages", page.hasMorePages());

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("items", page.items());
    data.put("pagination", pagination);

    if (withLinks) {
      final Map<String, Object> derived = new LinkedHashMap<>();
      derived.put("self", pageUrl(page.page(), page.perPage()));
      derived.put("first", pageUrl(1, page.perPage()));
      derived.put("last", pageUrl(page.lastPage(), page.perPage()));
      if (page.page() > 1) {
        derived.put("prev", pageUrl(page.page() - 1, page.perPage()));
      }
      if (page.hasMorePages()) {
        derived.put("next", pageUrl(page.page() + 1, page.perPage()));
      }
      if (links != null) {
        derived.putAll(links);
      }
      links = derived;
    }
    return success(data, message == null ? "Success" : message);
  }

  public ResponseEntity<ResponseEnvelope> bulkOperation(
      int successCount, int failCount, List<?> results, String operationName) {
    final Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("total", successCount + failCount);
    summary.put("successful", successCount);
    summary.put("failed", failCount);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("summary", summary);
    if (results != null && !results.isEmpty()) {
      data.put("results", results);
    }
    final String message =
        "Bulk "
            + operationName
            + " completed: "
            + successCount
            + " successful, "
            + failCount
            + " failed";
    return success(data, message);
  }

  public ResponseEntity<ResponseEnvelope> collection(Collection<?> items, String message) {
    meta().put("count", items.size());
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("items", items);
    return success(data, message == null ? "Success" : message);
  }

  public ResponseEntity<ResponseEnvelope> partialContent(
      Object data, long from, long to, long total, String message) {
    final Map<String, Object> range = new LinkedHashMap<>();
    range.put("from", from);
    range.put("to", to);
    range.put("total", total);
    meta().put("range", range);
    final HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.CONTENT_RANGE, "items " + from + "-" + to + "/" + total);
    return emit(
        true,
        HttpStatus.PARTIAL_CONTENT,
        message == null ? "Partial content" : message,
        data,
        null,
        headers);
  }

  private ResponseEntity<ResponseEnvelope> emit(
      boolean success,
      HttpStatus status,
      String message,
      Object data,
      Object errors,
      HttpHeaders extraHeaders) {
    try {
      final ResponseEnvelope envelope =
          new ResponseEnvelope(
              success,
              message,
              status.value(),
              data,
              ErrorFormatter.format(errors),
              correlationId,
              links,
              meta,
              properties.isProduction() ? null : debug,
              Instant.now(clock).toString(),
              requestId());
      final HttpHeaders headers = securityHeaders();
      headers.addAll(extraHeaders);
      return ResponseEntity.status(status).headers(headers).body(envelope);
    } finally {
      reset();
    }
  }

  private HttpHeaders securityHeaders() {
    final HttpHeaders headers = new HttpHeaders();
    headers.set(CONTENT_TYPE_OPTIONS, "nosniff");
    headers.set(FRAME_OPTIONS, "DENY");
    headers.set(XSS_PROTECTION, "1; mode=block");
    if (correlationId == null) {
      return headers;
    }
    // CorrelationIdFilter が設定済みのヘッダーは上書きし、ResponseEntity 側には重ねない
    if (response == null) {
      headers.set(AuditContextKeys.CORRELATION_ID_HEADER, correlationId);
    } else if (!response.isCommitted()) {
      response.setHeader(AuditContextKeys.CORRELATION_ID_HEADER, correlationId);
    }
    return headers;
  }

  private void recordException(Throwable exception, HttpStatus status) {
    final String handler =
        request != null && request.getAttribute(AuditContextKeys.HANDLER_ATTRIBUTE) instanceof String h
            ? h
            : ApiResponder.class.getSimpleName() + "@error";
    final int separator = handler.indexOf('@');
    final String service = separator < 0 ? handler : handler.substring(0, separator);
    final String method = separator < 0 ? "unknown" : handler.substring(separator + 1);
    final Map<String, Object> context = new LinkedHashMap<>();
    context.put("status_code", status.value());
    if (request != null) {
      context.put("path", request.getRequestURI());
    }
    auditLogger.logServiceError(service, method, exception, context);

    if (!properties.isProduction()) {
      debug().put("exception", exception.getClass().getName());
      debug().put("exception_message", exception.getMessage());
      final StackTraceElement[] trace = exception.getStackTrace();
      if (trace.length > 0) {
        debug().put("file", trace[0].getFileName());
        debug().put("line", trace[0].getLineNumber());
      }
    }
  }

  private String pageUrl(int page, int perPage) {
    final UriComponentsBuilder builder =
        request != null
            ? ServletUriComponentsBuilder.fromRequest(request)
            : UriComponentsBuilder.fromPath("");
    return builder
        .replaceQueryParam("page", page)
        .replaceQueryParam("per_page", perPage)
        .toUriString();
  }

  private String requestId() {
    if (request == null) {
      return null;
    }
    final String requestId = request.getHeader(AuditContextKeys.REQUEST_ID_HEADER);
    return requestId == null || requestId.isBlank() ? null : requestId;
  }

  private Map<String, Object> links() {
    if (links == null) {
      links = new LinkedHashMap<>();
    }
    return links;
  }

  private Map<String, Object> meta() {
    if (meta == null) {
      meta = new LinkedHashMap<>();
    }
    return meta;
  }

  private Map<String, Object> debug() {
    if (debug == null) {
      debug = new LinkedHashMap<>();
    }
    return debug;
  }

  private void reset() {
    correlationId = null;
    links = null;
    meta = null;
    debug = null;
  }
}
