package com.usermgmt.user.service;

public class UserNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public UserNotFoundException(String message) {
    super(message);
  }

  public static UserNotFoundException byId(long id) {
    return new UserNotFoundException("user not found: id=" + id);
  }
}
