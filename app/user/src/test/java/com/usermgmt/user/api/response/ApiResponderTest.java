package com.usermgmt.user.api.response;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.verify;

import com.usermgmt.user.config.UserApiProperties;
import com.usermgmt.user.logging.AuditContextKeys;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.model.PageResult;
import com.usermgmt.user.service.BulkOperationResult;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

@ExtendWith(MockitoExtension.class)
class ApiResponderTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

  @Mock private AuditLogger auditLogger;

  @Test
  void successWrapsDataAndSetsSecurityHeaders() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).success(Map.of("id", 1), "Loaded");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    final ResponseEnvelope body = response.getBody();
    assertThat(body.success()).isTrue();
    assertThat(body.code()).isEqualTo(200);
    assertThat(body.message()).isEqualTo("Loaded");
    assertThat(body.data()).isEqualTo(Map.of("id", 1));
    assertThat(body.timestamp()).isEqualTo("2026-01-01T00:00:00Z");
    assertThat(body.errors()).isNull();
    final HttpHeaders headers = response.getHeaders();
    assertThat(headers.getFirst("X-Content-Type-Options")).isEqualTo("nosniff");
    assertThat(headers.getFirst("X-Frame-Options")).isEqualTo("DENY");
    assertThat(headers.getFirst("X-XSS-Protection")).isEqualTo("1; mode=block");
  }

  @Test
  void defaultSuccessMessage() {
    assertThat(responder("local", null).success(null).getBody().message()).isEqualTo("Success");
  }

  @Test
  void configuredStateDoesNotLeakIntoNextResponse() {
    final ApiResponder responder = responder("local", null);

    final ResponseEntity<ResponseEnvelope> first =
        responder
            .setCorrelationId("corr-1")
            .withMeta(Map.of("source", "cache"))
            .withLinks(Map.of("self", "/users/1"))
            .withDebug(Map.of("query_count", 2))
            .success("first");
    final ResponseEntity<ResponseEnvelope> second = responder.success("second");

    assertThat(first.getBody().correlationId()).isEqualTo("corr-1");
    assertThat(first.getBody().meta()).containsEntry("source", "cache");
    assertThat(first.getBody().links()).containsEntry("self", "/users/1");
    assertThat(first.getBody().debug()).containsEntry("query_count", 2);
    assertThat(first.getHeaders().getFirst(AuditContextKeys.CORRELATION_ID_HEADER))
        .isEqualTo("corr-1");

    assertThat(second.getBody().correlationId()).isNull();
    assertThat(second.getBody().meta()).isNull();
    assertThat(second.getBody().links()).isNull();
    assertThat(second.getBody().debug()).isNull();
    assertThat(second.getHeaders().containsKey(AuditContextKeys.CORRELATION_ID_HEADER)).isFalse();
  }

  @Test
  void debugIsNeverEmittedInProduction() {
    final RuntimeException failure = new IllegalStateException("database password is wrong");

    final ResponseEntity<ResponseEnvelope> response =
        responder("production", null)
            .withDebug(Map.of("query_count", 2))
            .serverError("Internal server error", failure);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().debug()).isNull();
    assertThat(response.getBody().message()).isEqualTo("Internal server error");
  }

  @Test
  void serverErrorRecordsServiceErrorWithHandlerAndAddsDebugOutsideProduction() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/users");
    request.setAttribute(AuditContextKeys.HANDLER_ATTRIBUTE, "UserController@store");
    final RuntimeException failure = new IllegalStateException("boom");

    final ResponseEntity<ResponseEnvelope> response =
        responder("local", request).serverError(null, failure);

    verify(auditLogger).logServiceError(eq("UserController"), eq("store"), same(failure), anyMap());
    assertThat(response.getBody().message()).isEqualTo("Internal server error");
    assertThat(response.getBody().debug())
        .containsEntry("exception", IllegalStateException.class.getName())
        .containsEntry("exception_message", "boom")
        .containsKey("file")
        .containsKey("line");
  }

  @Test
  void notFoundNamesResourceType() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).notFound(null, "User");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().success()).isFalse();
    assertThat(response.getBody().message()).isEqualTo("User not found");
    assertThat(responder("local", null).notFound(null, null).getBody().message())
        .isEqualTo("Resource not found");
  }

  @Test
  void validationErrorFormatsFieldErrors() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null)
            .validationError(Map.of("email", List.of("The email field is required.")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().message()).isEqualTo("Validation failed");
    assertThat(response.getBody().errors())
        .containsExactly(
            Map.of("field", "email", "messages", List.of("The email field is required.")));
  }

  @Test
  void unauthorizedAdvertisesBearerRealm() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).unauthorized(null, "user-api");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE))
        .isEqualTo("Bearer realm=\"user-api\"");
    assertThat(response.getBody().message()).isEqualTo("Unauthorized");
  }

  @Test
  void forbiddenCarriesReasonInMeta() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).forbidden(null, "missing permission users:force_delete");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody().meta())
        .containsEntry("reason", "missing permission users:force_delete");
  }

  @Test
  void tooManyRequestsSetsRetryAfter() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).tooManyRequests(null, 30);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
    assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("30");
    assertThat(response.getBody().meta()).containsEntry("retry_after", 30);
  }

  @Test
  void createdSetsLocation() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).created(Map.of(), null, URI.create("/users/1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(response.getHeaders().getLocation()).isEqualTo(URI.create("/users/1"));
    assertThat(response.getBody().message()).isEqualTo("Created successfully");
  }

  @Test
  void noContentHasNoBody() {
    final ResponseEntity<ResponseEnvelope> response = responder("local", null).noContent();

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    assertThat(response.getBody()).isNull();
    assertThat(response.getHeaders().getFirst("X-Frame-Options")).isEqualTo("DENY");
  }

  @Test
  @SuppressWarnings("unchecked")
  void paginatedDerivesPaginationAndLinks() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users");
    request.setQueryString("page=2&per_page=2");
    request.addParameter("page", "2");
    request.addParameter("per_page", "2");

    final ResponseEntity<ResponseEnvelope> response =
        responder("local", request)
            .paginated(new PageResult<>(List.of("c", "d"), 2, 2, 5), "Users retrieved");

    final Map<String, Object> data = (Map<String, Object>) response.getBody().data();
    assertThat(data.get("items")).isEqualTo(List.of("c", "d"));
    final Map<String, Object> pagination = (Map<String, Object>) data.get("pagination");
    assertThat(pagination)
        .containsEntry("current_page", 2)
        .containsEntry("per_page", 2)
        .containsEntry("total", 5L)
        .containsEntry("last_page", 3)
        .containsEntry("from", 3L)
        .containsEntry("to", 4L)
        .containsEntry("has_more_pages", true);
    final Map<String, Object> links = response.getBody().links();
    assertThat(links).containsKeys("self", "first", "last", "prev", "next");
    assertThat((String) links.get("next")).contains("page=3").contains("per_page=2");
    assertThat((String) links.get("prev")).contains("page=1");
  }

  @Test
  @SuppressWarnings("unchecked")
  void paginatedOmitsPrevOnFirstPageAndNextOnLastPage() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", new MockHttpServletRequest("GET", "/users"))
            .paginated(new PageResult<>(List.of("a"), 1, 15, 1), null);

    assertThat(response.getBody().links()).doesNotContainKeys("prev", "next");
    final Map<String, Object> data = (Map<String, Object>) response.getBody().data();
    assertThat((Map<String, Object>) data.get("pagination")).containsEntry("last_page", 1);
  }

  @Test
  @SuppressWarnings("unchecked")
  void bulkOperationSummarizesResults() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null)
            .bulkOperation(
                2,
                1,
                List.of(new BulkOperationResult.ItemResult(3L, false, "User not found")),
                "delete");

    assertThat(response.getBody().message())
        .isEqualTo("Bulk delete completed: 2 successful, 1 failed");
    final Map<String, Object> data = (Map<String, Object>) response.getBody().data();
    assertThat((Map<String, Object>) data.get("summary"))
        .containsEntry("total", 3)
        .containsEntry("successful", 2)
        .containsEntry("failed", 1);
  }

  @Test
  void collectionCountsItems() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).collection(List.of("a", "b", "c"), null);

    assertThat(response.getBody().meta()).containsEntry("count", 3);
  }

  @Test
  void partialContentSetsContentRange() {
    final ResponseEntity<ResponseEnvelope> response =
        responder("local", null).partialContent(List.of("a"), 0, 9, 100, null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PARTIAL_CONTENT);
    assertThat(response.getHeaders().getFirst(HttpHeaders.CONTENT_RANGE))
        .isEqualTo("items 0-9/100");
    assertThat(response.getBody().meta()).containsKey("range");
  }

  @Test
  void requestCorrelationAndRequestIdsAreEchoed() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/1");
    request.setAttribute(AuditContextKeys.CORRELATION_ID_ATTRIBUTE, "corr-9");
    request.addHeader(AuditContextKeys.REQUEST_ID_HEADER, "req-9");

    final ResponseEnvelope body =
        responder("local", request).withRequestCorrelationId().success("ok").getBody();

    assertThat(body.correlationId()).isEqualTo("corr-9");
    assertThat(body.requestId()).isEqualTo("req-9");
  }

  private ApiResponder responder(String environment, MockHttpServletRequest request) {
    return new ApiResponder(
        new UserApiProperties(environment, null), auditLogger, CLOCK, request);
  }
}
