/*
 * どこで: user のログ設定テスト
 * 何を: JSON ログ設定と相関 ID などの MDC フィールド定義の存在を検証する
 * なぜ: 設定変更で構造化ログや監査チャネルの出力が欠落する回帰を防ぐため
 */
package com.usermgmt.user;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonAndCorrelationFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"correlation_id\":\"%X{correlation_id:-}\"");
    assertThat(configText).contains("\"request_id\":\"%X{request_id:-}\"");
    assertThat(configText).contains("\"handler\":\"%X{handler:-}\"");
    assertThat(configText).contains("<arguments/>");
    assertThat(configText).contains("<logger name=\"audit\"");
  }
}
