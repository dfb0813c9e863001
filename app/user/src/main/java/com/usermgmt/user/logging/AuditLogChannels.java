/*
 * どこで: 監査ログ
 * 何を: チャネル (api/database/performance など) ごとの SLF4J ロガーへ構造化ログを書き出す
 * なぜ: ログ収集側でチャネル名によりルーティング/保持期間を分けられるようにするため
 */
package com.usermgmt.user.logging;

import static net.logstash.logback.argument.StructuredArguments.entries;

import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

@Component
public class AuditLogChannels {

  private final Map<AuditChannel, Logger> loggers = new EnumMap<>(AuditChannel.class);

  public AuditLogChannels() {
    for (AuditChannel channel : AuditChannel.values()) {
      loggers.put(channel, LoggerFactory.getLogger(channel.loggerName()));
    }
  }

  public void write(AuditChannel channel, Level level, String message, Map<String, ?> context) {
    final Logger logger = loggers.get(channel);
    final Object fields = entries(context == null ? Map.of() : context);
    switch (level) {
      case ERROR -> logger.error(message, fields);
      case WARN -> logger.warn(message, fields);
      case DEBUG -> logger.debug(message, fields);
      case TRACE -> logger.trace(message, fields);
      default -> logger.info(message, fields);
    }
  }
}
