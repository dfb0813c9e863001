package com.usermgmt.user.model;

public record UserStatistics(
    long totalUsers, long activeUsers, long disabledUsers, long lockedUsers, long verifiedUsers) {}
