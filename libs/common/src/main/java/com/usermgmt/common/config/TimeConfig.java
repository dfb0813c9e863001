/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: ロック期限や監査時刻をテストで固定/前進できるようにするため
 */
package com.usermgmt.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
