/*
 * どこで: 共通ユーティリティ
 * 何を: 相関 ID / 監査ログ ID を時刻順で採番する
 * なぜ: ログの並び順と応答ヘッダーの ID を同じ規則で扱うため
 */
package com.usermgmt.common;

import com.github.f4b6a3.tsid.TsidCreator;
import java.util.concurrent.atomic.AtomicLong;

public final class CorrelationIds {

  private static final AtomicLong FALLBACK_SEQUENCE = new AtomicLong();
  private static final String FALLBACK_PREFIX = "local-";

  private CorrelationIds() {}

  // 採番に失敗しても呼び出し側へ例外を返さず、プロセス内カウンタで代替する
  public static String newCorrelationId() {
    try {
      return TsidCreator.getTsid().toString();
    } catch (RuntimeException ex) {
      return fallbackId();
    }
  }

  public static String newAuditId() {
    return newCorrelationId();
  }

  static String fallbackId() {
    return FALLBACK_PREFIX
        + System.currentTimeMillis()
        + "-"
        + FALLBACK_SEQUENCE.incrementAndGet();
  }
}
