package com.usermgmt.user.api;

import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.api.response.ResponseEnvelope;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

  private final ApiResponderFactory responders;
  private final ApplicationContext applicationContext;
  private final Clock clock;

  @GetMapping("/health")
  public ResponseEntity<ResponseEnvelope> health() {
    final long uptimeSeconds =
        Math.max(0L, (clock.millis() - applicationContext.getStartupDate()) / 1000L);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("status", "running");
    data.put("uptime", uptimeSeconds);
    return responders.create().withRequestCorrelationId().success(data, "API is healthy");
  }
}
