/*
 * どこで: 共通ユーティリティ
 * 何を: 構造化データ/文字列に含まれる機微情報をマスクする
 * なぜ: 監査ログへ平文の資格情報を残さないため
 */
package com.usermgmt.common;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Masks values stored under sensitive keys.
 *
 * <p>Map input is walked recursively (nested maps and lists included) and every value whose key
 * matches the key set, compared in lower case, is replaced by the mask whatever its type. String
 * input is scanned for {@code key: value} / {@code key=value} fragments and only the value part is
 * masked. Null and empty input are returned unchanged. None of the methods throw.
 */
public final class SensitiveDataRedactor {

  public static final String DEFAULT_MASK = "***REDACTED***";

  public static final Set<String> DEFAULT_KEYS =
      Set.of(
          "password",
          "password_confirmation",
          "current_password",
          "pwd",
          "token",
          "secret",
          "api_key",
          "apikey",
          "x-api-key",
          "credit_card",
          "cvv",
          "pin",
          "authorization",
          "access_token",
          "refresh_token",
          "client_secret",
          "private_key",
          "signature",
          "x-internal-token");

  private static final Pattern DEFAULT_PATTERN = compile(DEFAULT_KEYS);

  private SensitiveDataRedactor() {}

  public static Map<String, Object> redact(Map<String, ?> data) {
    return redact(data, DEFAULT_KEYS, DEFAULT_MASK);
  }

  public static Map<String, Object> redact(Map<String, ?> data, Set<String> keys, String mask) {
    if (data == null) {
      return null;
    }
    final Set<String> normalized = normalize(keys);
    return redactMap(data, normalized, mask);
  }

  public static String redact(String text) {
    return redactString(text, DEFAULT_PATTERN, DEFAULT_MASK);
  }

  public static String redact(String text, Set<String> keys, String mask) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    return redactString(text, compile(normalize(keys)), mask);
  }

  private static Map<String, Object> redactMap(Map<?, ?> data, Set<String> keys, String mask) {
    final Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : data.entrySet()) {
      final String key = String.valueOf(entry.getKey());
      if (keys.contains(key.toLowerCase(Locale.ROOT))) {
        out.put(key, mask);
      } else {
        out.put(key, redactValue(entry.getValue(), keys, mask));
      }
    }
    return out;
  }

  private static Object redactValue(Object value, Set<String> keys, String mask) {
    if (value instanceof Map<?, ?> nested) {
      return redactMap(nested, keys, mask);
    }
    if (value instanceof Collection<?> items) {
      final List<Object> out = new ArrayList<>(items.size());
      for (Object item : items) {
        out.add(redactValue(item, keys, mask));
      }
      return out;
    }
    return value;
  }

  private static String redactString(String text, Pattern pattern, String mask) {
    if (text == null || text.isEmpty() || pattern == null) {
      return text;
    }
    final Matcher matcher = pattern.matcher(text);
    final StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      matcher.appendReplacement(
          out, Matcher.quoteReplacement(matcher.group(1) + matcher.group(2) + mask));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private static Set<String> normalize(Set<String> keys) {
    if (keys == null) {
      return Set.of();
    }
    return keys.stream()
        .filter(k -> k != null && !k.isBlank())
        .map(k -> k.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }

  private static Pattern compile(Set<String> keys) {
    if (keys.isEmpty()) {
      return null;
    }
    // 長いキーを先に並べ、access_token が token より優先して一致するようにする
    final String alternation =
        keys.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    return Pattern.compile(
        "(?<![\\w-])(" + alternation + ")(\\s*[:=]\\s*)(?:(?:bearer|basic)\\s+)?[^\\s,;&]+",
        Pattern.CASE_INSENSITIVE);
  }
}
