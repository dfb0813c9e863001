package com.usermgmt.user.model;

import java.time.Instant;

public record PermissionRecord(
    Long id, Long userId, String resource, String action, Long resourceId, Instant createdAt) {}
