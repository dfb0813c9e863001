package com.usermgmt.user.api;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.usermgmt.common.config.TimeConfig;
import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.config.AppConfig;
import com.usermgmt.user.config.RequestMdcInterceptor;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.logging.SqlStatementCollector;
import com.usermgmt.user.model.UserRecord;
import com.usermgmt.user.service.UserService;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CurrentUserController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({
  ApiExceptionHandler.class,
  ApiResponderFactory.class,
  AppConfig.class,
  TimeConfig.class,
  RequestMdcInterceptor.class
})
class CurrentUserControllerTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private UserService userService;
  @MockitoBean private AuditLogger auditLogger;
  @MockitoBean private SqlStatementCollector sqlStatementCollector;

  @Test
  void returnsForwardedUser() throws Exception {
    when(userService.findById(42L)).thenReturn(Optional.of(record(42L)));

    mockMvc
        .perform(get("/user").with(user("42")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.id").value(42))
        .andExpect(jsonPath("$.data.email").value("me@example.com"));
  }

  @Test
  void omitsDataWithoutPrincipal() throws Exception {
    mockMvc
        .perform(get("/user"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data").doesNotExist());

    verify(userService, never()).findById(anyLong());
  }

  @Test
  void nonNumericPrincipalIsTreatedAsAnonymous() throws Exception {
    mockMvc
        .perform(get("/user").with(user("gateway")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data").doesNotExist());

    verify(userService, never()).findById(anyLong());
  }

  private static UserRecord record(long id) {
    return new UserRecord(
        id, "20260101000000123456", "Me", "me@example.com", "hash", null, null, null, null,
        NOW, true, null, 0, null, null, null, null, NOW, NOW);
  }
}
