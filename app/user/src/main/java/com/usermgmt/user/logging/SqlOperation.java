/*
 * どこで: 監査ログ
 * 何を: 監査ログ 1 行の操作種別
 * なぜ: SQL 文の先頭キーワードから種別を推定し、必ず値を持たせるため
 */
package com.usermgmt.user.logging;

import java.util.Locale;
import java.util.Map;

public enum SqlOperation {
  SELECT,
  INSERT,
  UPDATE,
  DELETE,
  CREATE,
  ALTER,
  DROP,
  HTTP_REQUEST,
  ERROR,
  UNKNOWN;

  private static final SqlOperation[] STATEMENT_KEYWORDS = {
    SELECT, INSERT, UPDATE, DELETE, CREATE, ALTER, DROP
  };

  // サービス操作名 -> 実際に発行される SQL 種別
  private static final Map<String, SqlOperation> SERVICE_OPERATIONS =
      Map.ofEntries(
          Map.entry("list", SELECT),
          Map.entry("search", SELECT),
          Map.entry("find", SELECT),
          Map.entry("statistics", SELECT),
          Map.entry("create", INSERT),
          Map.entry("update", UPDATE),
          Map.entry("restore", UPDATE),
          Map.entry("lock", UPDATE),
          Map.entry("unlock", UPDATE),
          Map.entry("enable", UPDATE),
          Map.entry("disable", UPDATE),
          Map.entry("delete", UPDATE),
          Map.entry("force_delete", DELETE));

  /** 先頭キーワード (大文字小文字無視) で判定し、該当しなければ UNKNOWN。 */
  public static SqlOperation detect(String sql) {
    if (sql == null) {
      return UNKNOWN;
    }
    final String normalized = sql.stripLeading().toUpperCase(Locale.ROOT);
    for (SqlOperation candidate : STATEMENT_KEYWORDS) {
      if (normalized.startsWith(candidate.name())) {
        return candidate;
      }
    }
    return UNKNOWN;
  }

  public static SqlOperation forServiceOperation(String operation, String fallbackSql) {
    if (operation != null) {
      final String key = operation.trim().toLowerCase(Locale.ROOT);
      final SqlOperation mapped = SERVICE_OPERATIONS.get(key);
      if (mapped != null) {
        return mapped;
      }
      for (SqlOperation candidate : values()) {
        if (candidate.name().equalsIgnoreCase(key)) {
          return candidate;
        }
      }
    }
    return detect(fallbackSql);
  }
}
