package com.usermgmt.user.model;

import java.util.Locale;

public enum Gender {
  MALE,
  FEMALE,
  OTHER;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Gender fromValue(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return Gender.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
