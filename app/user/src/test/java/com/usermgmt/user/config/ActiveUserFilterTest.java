package com.usermgmt.user.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.logging.AuditContextKeys;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.model.Gender;
import com.usermgmt.user.model.UserRecord;
import com.usermgmt.user.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class ActiveUserFilterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private UserRepository userRepository;
  @Mock private AuditLogger auditLogger;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ActiveUserFilter filter;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    filter =
        new ActiveUserFilter(
            userRepository,
            new ApiResponderFactory(new UserApiProperties("testing", null), auditLogger, clock),
            auditLogger,
            objectMapper,
            clock);
  }

  @AfterEach
  void cleanup() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void disabledUserIsRejectedWithEnvelope() throws Exception {
    authenticate("42");
    when(userRepository.findById(42L)).thenReturn(Optional.of(user(42L, false, null)));
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/users/7");
    request.setAttribute(AuditContextKeys.CORRELATION_ID_ATTRIBUTE, "corr-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();
    final AtomicBoolean reached = new AtomicBoolean();

    filter.doFilter(request, response, (req, res) -> reached.set(true));

    assertThat(reached).isFalse();
    assertThat(response.getStatus()).isEqualTo(403);
    assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("corr-1");
    final JsonNode body = objectMapper.readTree(response.getContentAsByteArray());
    assertThat(body.get("success").asBoolean()).isFalse();
    assertThat(body.get("message").asText()).isEqualTo("Your account has been disabled");
    assertThat(body.get("meta").get("reason").asText()).isEqualTo("disabled");
    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    verify(auditLogger)
        .logAuthEvent(
            eq("inactive_user_rejected"),
            eq(42L),
            argThat(data -> "disabled".equals(data.get("reason"))));
  }

  @Test
  void lockedUserIsRejectedUntilLockExpires() throws Exception {
    authenticate("42");
    when(userRepository.findById(42L))
        .thenReturn(Optional.of(user(42L, true, NOW.plusSeconds(300))));
    final MockHttpServletResponse response = new MockHttpServletResponse();
    final AtomicBoolean reached = new AtomicBoolean();

    filter.doFilter(
        new MockHttpServletRequest("PUT", "/users/7"), response, (req, res) -> reached.set(true));

    assertThat(reached).isFalse();
    assertThat(response.getStatus()).isEqualTo(403);
    final JsonNode body = objectMapper.readTree(response.getContentAsByteArray());
    assertThat(body.get("message").asText()).isEqualTo("Your account is locked");
    verify(auditLogger)
        .logAuthEvent(
            eq("inactive_user_rejected"),
            eq(42L),
            argThat(data -> "locked".equals(data.get("reason"))));
  }

  @Test
  void expiredLockPassesThrough() throws Exception {
    authenticate("42");
    when(userRepository.findById(42L))
        .thenReturn(Optional.of(user(42L, true, NOW.minusSeconds(1))));
    final AtomicBoolean reached = new AtomicBoolean();

    filter.doFilter(
        new MockHttpServletRequest("GET", "/users"),
        new MockHttpServletResponse(),
        (req, res) -> reached.set(true));

    assertThat(reached).isTrue();
    verify(auditLogger, never()).logAuthEvent(anyString(), any(), anyMap());
  }

  @Test
  void anonymousOrNonNumericPrincipalIsNotLookedUp() throws Exception {
    final AtomicBoolean reached = new AtomicBoolean();
    filter.doFilter(
        new MockHttpServletRequest("GET", "/health"),
        new MockHttpServletResponse(),
        (req, res) -> reached.set(true));

    authenticate("service-account");
    final AtomicBoolean reachedNamed = new AtomicBoolean();
    filter.doFilter(
        new MockHttpServletRequest("GET", "/users"),
        new MockHttpServletResponse(),
        (req, res) -> reachedNamed.set(true));

    assertThat(reached).isTrue();
    assertThat(reachedNamed).isTrue();
    verifyNoInteractions(userRepository);
  }

  private static void authenticate(String principal) {
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                principal, "N/A", List.of(new SimpleGrantedAuthority("ROLE_INTERNAL"))));
  }

  private static UserRecord user(long id, boolean enabled, Instant lockedUntil) {
    return new UserRecord(
        id,
        "20260101000000000001",
        "Alice",
        "alice@example.com",
        "$2a$10$hash",
        null,
        null,
        Gender.FEMALE,
        null,
        NOW,
        enabled,
        lockedUntil,
        lockedUntil == null ? 0 : 1,
        null,
        null,
        null,
        null,
        NOW,
        NOW);
  }
}
