package com.usermgmt.user.service;

/** 論理削除されていないユーザーと email/phone が重複した。 */
public class UserConflictException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String field;

  public UserConflictException(String field, String message) {
    super(message);
    this.field = field;
  }

  public UserConflictException(String field, String message, Throwable cause) {
    super(message, cause);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
