/*
 * どこで: User API セキュリティ設定
 * 何を: ゲートウェイ転送 ID の取り込みとセキュリティヘッダーを構成する
 * なぜ: 認証本体は外部に任せ、操作ごとの権限判定だけをこのサービスで行うため
 */
package com.usermgmt.user.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.logging.AuditLogger;
import com.usermgmt.user.repository.UserRepository;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.header.writers.XXssProtectionHeaderWriter;

@Configuration
@EnableConfigurationProperties(InternalApiProperties.class)
public class SecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      InternalApiProperties properties, AuditLogger auditLogger) {
    return new InternalApiAuthenticationFilter(properties, auditLogger);
  }

  @Bean
  ActiveUserFilter activeUserFilter(
      UserRepository userRepository,
      ApiResponderFactory responderFactory,
      AuditLogger auditLogger,
      ObjectMapper objectMapper,
      Clock clock) {
    return new ActiveUserFilter(
        userRepository, responderFactory, auditLogger, objectMapper, clock);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      InternalApiAuthenticationFilter internalApiAuthenticationFilter,
      ActiveUserFilter activeUserFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(
            headers ->
                headers
                    .contentTypeOptions(contentTypeOptions -> {})
                    .frameOptions(frameOptions -> frameOptions.deny())
                    .xssProtection(
                        xss ->
                            xss.headerValue(
                                XXssProtectionHeaderWriter.HeaderValue.ENABLED_MODE_BLOCK)))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .addFilterAfter(activeUserFilter, InternalApiAuthenticationFilter.class)
        // 操作ごとの権限は PermissionService で判定する
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
    return http.build();
  }
}
