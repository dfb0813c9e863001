package com.usermgmt.user.logging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.usermgmt.user.model.AuditLogRecord;
import com.usermgmt.user.repository.AuditLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.event.Level;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class StructuredAuditLoggerTest {

  @Mock private AuditLogRepository auditLogRepository;
  @Mock private AuditLogChannels channels;
  @Mock private AuditActorResolver actorResolver;

  @Captor private ArgumentCaptor<AuditLogRecord> recordCaptor;
  @Captor private ArgumentCaptor<Map<String, Object>> contextCaptor;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private StructuredAuditLogger auditLogger;

  @BeforeEach
  void setUp() {
    lenient()
        .when(actorResolver.resolve())
        .thenReturn(new AuditActor(7L, "7", "203.0.113.10", "junit"));
    auditLogger =
        new StructuredAuditLogger(
            auditLogRepository,
            channels,
            actorResolver,
            new AuditMetrics(registry),
            objectMapper,
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void logSqlWritesRowWithDetectedOperationAndRedactedParams() throws Exception {
    auditLogger.logSql(
        new SqlStatement(
            "select * from users where email = :email",
            Map.of("email", "a@example.com", "password", "secret-value"),
            null,
            Duration.ofMillis(5),
            "UserRepository",
            false,
            null));

    verify(auditLogRepository).insert(recordCaptor.capture());
    final AuditLogRecord row = recordCaptor.getValue();
    assertThat(row.operation()).isEqualTo(SqlOperation.SELECT);
    assertThat(row.module()).isEqualTo("UserRepository");
    assertThat(row.message()).isEqualTo("Success");
    assertThat(row.executedBy()).isEqualTo("7");
    assertThat(row.userId()).isEqualTo(7L);
    assertThat(row.ipAddress()).isEqualTo("203.0.113.10");
    final JsonNode params = objectMapper.readTree(row.sqlParamsJson());
    assertThat(params.get("password").asText()).isEqualTo("***REDACTED***");
    assertThat(params.get("email").asText()).isEqualTo("a@example.com");
    verify(channels, never()).write(eq(AuditChannel.PERFORMANCE), any(), any(), any());
  }

  @Test
  void slowSqlEmitsPerformanceWarningWithTruncatedSnippet() {
    final String sql = "SELECT " + "x".repeat(300) + " FROM users";

    auditLogger.logSql(
        new SqlStatement(
            sql, Map.of(), null, Duration.ofMillis(1200), "UserRepository", false, null));

    verify(auditLogRepository).insert(any());
    verify(channels)
        .write(
            eq(AuditChannel.PERFORMANCE),
            eq(Level.WARN),
            eq("Slow query detected: SELECT"),
            contextCaptor.capture());
    final Map<String, Object> context = contextCaptor.getValue();
    assertThat(context.get("duration_ms")).isEqualTo(1200.0);
    assertThat(context.get("threshold_ms")).isEqualTo(1000.0);
    assertThat(context.get("exceeded_by_ms")).isEqualTo(200.0);
    @SuppressWarnings("unchecked")
    final Map<String, Object> metadata = (Map<String, Object>) context.get("metadata");
    assertThat((String) metadata.get("sql")).hasSize(StructuredAuditLogger.SNIPPET_MAX_LENGTH);
    assertThat(metadata.get("module")).isEqualTo("UserRepository");
    assertThat(
            registry
                .get("usermgmt.slow.operation.total")
                .tag("kind", "sql_query")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void operationExactlyAtThresholdIsNotSlow() {
    auditLogger.logSql(
        new SqlStatement(
            "SELECT 1", Map.of(), null, Duration.ofMillis(1000), "UserRepository", false, null));

    verify(channels, never()).write(eq(AuditChannel.PERFORMANCE), any(), any(), any());
  }

  @Test
  void auditStoreFailureFallsBackWithoutThrowing() {
    doThrow(new DataAccessResourceFailureException("connection refused"))
        .when(auditLogRepository)
        .insert(any());

    assertThatCode(
            () ->
                auditLogger.logSql(
                    SqlStatement.of("DELETE FROM users WHERE id = 1", Map.of(), Duration.ZERO)))
        .doesNotThrowAnyException();

    verify(channels)
        .write(
            eq(AuditChannel.FALLBACK),
            eq(Level.ERROR),
            eq("Failed to write audit log"),
            contextCaptor.capture());
    assertThat(contextCaptor.getValue().get("error")).isEqualTo("connection refused");
    assertThat(contextCaptor.getValue().get("type")).isEqualTo("sql");
    assertThat(
            registry
                .get("usermgmt.audit.write.failure.total")
                .tag("shape", "sql")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void logSqlBatchWritesOneBatch() {
    auditLogger.logSqlBatch(
        List.of(
            new SqlStatement(
                "SELECT * FROM users", Map.of(), null, Duration.ofMillis(2), "A", false, null),
            new SqlStatement(
                "UPDATE users SET enabled = false",
                Map.of(),
                null,
                Duration.ofMillis(3),
                "B",
                true,
                "boom")));

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<List<AuditLogRecord>> batchCaptor = ArgumentCaptor.forClass(List.class);
    verify(auditLogRepository).insertBatch(batchCaptor.capture());
    verify(auditLogRepository, never()).insert(any());
    final List<AuditLogRecord> rows = batchCaptor.getValue();
    assertThat(rows).hasSize(2);
    assertThat(rows.get(0).operation()).isEqualTo(SqlOperation.SELECT);
    assertThat(rows.get(1).operation()).isEqualTo(SqlOperation.UPDATE);
    assertThat(rows.get(1).error()).isTrue();
    assertThat(rows.get(1).message()).isEqualTo("boom");
  }

  @Test
  void emptyBatchWritesNothing() {
    auditLogger.logSqlBatch(List.of());

    verify(auditLogRepository, never()).insertBatch(anyList());
  }

  @Test
  void httpRequestRowUsesMethodAndPathAndRedactsBody() {
    final HttpRequestSnapshot snapshot =
        new HttpRequestSnapshot(
            "POST",
            "/users",
            Map.of("x-internal-token", "abc", "content-type", "application/json"),
            Map.of(),
            Map.of("email", "a@example.com", "password", "plain-secret"),
            "UserController@store",
            "198.51.100.1",
            "curl/8");

    auditLogger.logHttpRequest(snapshot, 201, Duration.ofMillis(15), false, null);

    verify(auditLogRepository).insert(recordCaptor.capture());
    final AuditLogRecord row = recordCaptor.getValue();
    assertThat(row.sqlText()).isEqualTo("HTTP POST /users");
    assertThat(row.operation()).isEqualTo(SqlOperation.HTTP_REQUEST);
    assertThat(row.module()).isEqualTo("UserController@store");
    assertThat(row.ipAddress()).isEqualTo("198.51.100.1");
    assertThat(row.userAgent()).isEqualTo("curl/8");
    assertThat(row.message()).isEqualTo("Success");
    assertThat(row.sqlParamsJson()).doesNotContain("plain-secret").doesNotContain("abc");
    assertThat(row.sqlParamsJson()).contains("\"status_code\":201");
  }

  @Test
  void failedHttpRequestWithoutMessageDefaultsToUnknownError() {
    final HttpRequestSnapshot snapshot =
        new HttpRequestSnapshot("GET", "/users/1", null, null, null, null, null, null);

    auditLogger.logHttpRequest(snapshot, 500, Duration.ofMillis(1), true, null);

    verify(auditLogRepository).insert(recordCaptor.capture());
    assertThat(recordCaptor.getValue().error()).isTrue();
    assertThat(recordCaptor.getValue().message()).isEqualTo("Unknown Error");
    assertThat(recordCaptor.getValue().module()).isEqualTo("unknown");
    assertThat(recordCaptor.getValue().ipAddress()).isEqualTo("203.0.113.10");
  }

  @Test
  void databaseOperationWritesChannelAndRow() {
    auditLogger.logDatabaseOperation("create", "User", 1L, Duration.ofMillis(3), Map.of());

    verify(channels)
        .write(
            eq(AuditChannel.DATABASE),
            eq(Level.INFO),
            eq("Database Operation: create on User"),
            contextCaptor.capture());
    assertThat(contextCaptor.getValue().get("id")).isEqualTo("1");
    verify(auditLogRepository).insert(recordCaptor.capture());
    assertThat(recordCaptor.getValue().sqlText()).isEqualTo("CREATE USERS");
    assertThat(recordCaptor.getValue().operation()).isEqualTo(SqlOperation.INSERT);
    assertThat(recordCaptor.getValue().message()).isEqualTo("Success");
  }

  @Test
  void failedDatabaseOperationIsMarkedFailed() {
    auditLogger.logDatabaseOperation(
        "update", "User", 5L, Duration.ofMillis(3), Map.of(), true, null);

    verify(channels).write(eq(AuditChannel.DATABASE), eq(Level.ERROR), any(), any());
    verify(auditLogRepository).insert(recordCaptor.capture());
    assertThat(recordCaptor.getValue().sqlText()).isEqualTo("UPDATE USERS FAILED");
    assertThat(recordCaptor.getValue().error()).isTrue();
    assertThat(recordCaptor.getValue().message()).isEqualTo("Query Failed");
  }

  @Test
  void databaseOperationWithoutEntityTypeStillWritesRow() {
    assertThatCode(
            () ->
                auditLogger.logDatabaseOperation(
                    "update", null, 1L, Duration.ofMillis(5), Map.of()))
        .doesNotThrowAnyException();

    verify(channels)
        .write(
            eq(AuditChannel.DATABASE),
            eq(Level.INFO),
            eq("Database Operation: update on unknown"),
            any());
    verify(auditLogRepository).insert(recordCaptor.capture());
    assertThat(recordCaptor.getValue().sqlText()).isEqualTo("UPDATE UNKNOWNS");
  }

  @Test
  void nullArgumentsAreReportedOnFallbackInsteadOfThrown() {
    assertThatCode(
            () -> {
              auditLogger.logHttpRequest(null, 200, Duration.ZERO, false, null);
              auditLogger.logSql(null);
              auditLogger.logServiceError("UserService", "createUser", null, Map.of());
              auditLogger.logApiError(null, "GET", "/users", 500);
              auditLogger.logApiRequest(null, 200, Duration.ZERO);
            })
        .doesNotThrowAnyException();

    for (String shape :
        List.of("http_request", "sql", "service_error", "api_error", "api_request")) {
      assertThat(
              registry
                  .get("usermgmt.audit.write.failure.total")
                  .tag("shape", shape)
                  .counter()
                  .count())
          .as(shape)
          .isEqualTo(1.0);
    }
    verify(auditLogRepository, never()).insert(any());
  }

  @Test
  void serviceErrorWritesErrorRow() {
    auditLogger.logServiceError(
        "UserService",
        "createUser",
        new IllegalStateException("db down"),
        Map.of("entity_id", 3L));

    verify(channels)
        .write(
            eq(AuditChannel.SERVICE_ERRORS),
            eq(Level.ERROR),
            eq("Service Error: UserService::createUser"),
            contextCaptor.capture());
    assertThat(contextCaptor.getValue().get("exception"))
        .isEqualTo(IllegalStateException.class.getName());
    assertThat(contextCaptor.getValue().get("entity_id")).isEqualTo(3L);
    verify(auditLogRepository).insert(recordCaptor.capture());
    final AuditLogRecord row = recordCaptor.getValue();
    assertThat(row.sqlText()).isEqualTo("Service error in UserService::createUser");
    assertThat(row.operation()).isEqualTo(SqlOperation.ERROR);
    assertThat(row.module()).isEqualTo("UserService");
    assertThat(row.error()).isTrue();
    assertThat(row.message()).isEqualTo("db down");
  }

  @Test
  void highSeverityUserActionsAreLoggedAtWarn() {
    auditLogger.logUserAction("deleted", 1L, "a@example.com", Map.of());
    auditLogger.logUserAction("disabled", 3L, "c@example.com", Map.of());
    auditLogger.logUserAction("created", 2L, "b@example.com", Map.of("password", "x"));

    verify(channels)
        .write(eq(AuditChannel.USER_ACTION), eq(Level.WARN), eq("User Action: deleted"), any());
    verify(channels)
        .write(eq(AuditChannel.USER_ACTION), eq(Level.WARN), eq("User Action: disabled"), any());
    verify(channels)
        .write(
            eq(AuditChannel.USER_ACTION),
            eq(Level.INFO),
            eq("User Action: created"),
            contextCaptor.capture());
    assertThat(contextCaptor.getValue().get("password")).isEqualTo("***REDACTED***");
  }

  @Test
  void failedApiRequestIsLoggedAtWarn() {
    auditLogger.logApiRequest(
        new HttpRequestSnapshot("GET", "/users/1", null, null, null, null, "10.0.0.1", "ua"),
        404,
        Duration.ofMillis(4));

    verify(channels)
        .write(
            eq(AuditChannel.API),
            eq(Level.WARN),
            startsWith("API request failed: GET /users/1"),
            contextCaptor.capture());
    assertThat(contextCaptor.getValue().get("status_code")).isEqualTo(404);
    assertThat(contextCaptor.getValue().get("ip")).isEqualTo("10.0.0.1");
  }

  @Test
  void serverSideApiErrorIsLoggedAtError() {
    auditLogger.logApiError(new RuntimeException("boom"), "GET", "/users", 500);

    verify(channels).write(eq(AuditChannel.API), eq(Level.ERROR), eq("boom"), any());
  }

  @Test
  void tableNameUpperCasesAndPluralizesSimpleName() {
    assertThat(StructuredAuditLogger.tableName("User")).isEqualTo("USERS");
    assertThat(StructuredAuditLogger.tableName("com.usermgmt.user.model.Permission"))
        .isEqualTo("PERMISSIONS");
  }

  @Test
  void redactValueMasksNestedStructures() {
    final Object redacted =
        StructuredAuditLogger.redactValue(
            List.of(Map.of("token", "t-1", "name", "n"), "password=hunter2"));

    assertThat(redacted.toString()).doesNotContain("t-1").doesNotContain("hunter2");
  }
}
