package com.usermgmt.user.api.response;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes the errors block of an envelope.
 *
 * <ul>
 *   <li>a bare string becomes {@code [{message}]}
 *   <li>a field-keyed map becomes {@code [{field, messages[]}]} in key order
 *   <li>a list, or a map keyed 0..n-1, passes through as a list
 * </ul>
 */
public final class ErrorFormatter {

  private ErrorFormatter() {}

  public static List<Object> format(Object errors) {
    if (errors == null) {
      return null;
    }
    if (errors instanceof CharSequence text) {
      final List<Object> formatted = new ArrayList<>();
      formatted.add(messageEntry(text.toString()));
      return formatted;
    }
    if (errors instanceof Collection<?> items) {
      return new ArrayList<>(items);
    }
    if (errors instanceof Map<?, ?> map) {
      if (isSequential(map)) {
        return new ArrayList<>(map.values());
      }
      final List<Object> formatted = new ArrayList<>(map.size());
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        final Map<String, Object> fieldEntry = new LinkedHashMap<>();
        fieldEntry.put("field", String.valueOf(entry.getKey()));
        fieldEntry.put("messages", messages(entry.getValue()));
        formatted.add(fieldEntry);
      }
      return formatted;
    }
    final List<Object> formatted = new ArrayList<>();
    formatted.add(messageEntry(String.valueOf(errors)));
    return formatted;
  }

  private static Map<String, Object> messageEntry(String message) {
    final Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("message", message);
    return entry;
  }

  private static List<String> messages(Object value) {
    final List<String> messages = new ArrayList<>();
    if (value instanceof Collection<?> items) {
      for (Object item : items) {
        messages.add(String.valueOf(item));
      }
    } else if (value != null) {
      messages.add(String.valueOf(value));
    }
    return messages;
  }

  private static boolean isSequential(Map<?, ?> map) {
    if (map.isEmpty()) {
      return false;
    }
    int expected = 0;
    for (Object key : map.keySet()) {
      if (!(key instanceof Integer index) || index != expected) {
        return false;
      }
      expected++;
    }
    return true;
  }
}
