package com.usermgmt.user.service;

/** Authorization grants are looked up per user; a null resourceId asks about the whole type. */
public interface PermissionChecker {

  boolean hasPermission(long userId, String resource, String action, Long resourceId);
}
