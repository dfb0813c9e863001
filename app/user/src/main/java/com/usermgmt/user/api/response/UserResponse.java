/*
 * どこで: User API DTO
 * 何を: ユーザー 1 件の出力 DTO
 * なぜ: パスワードハッシュなど内部項目を返さず、外部契約を安定させるため
 */
package com.usermgmt.user.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.usermgmt.user.model.UserRecord;
import java.time.Instant;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserResponse(
    Long id,
    String code,
    String name,
    String email,
    String phone,
    LocalDate dateOfBirth,
    String gender,
    String avatar,
    Instant emailVerifiedAt,
    boolean enabled,
    boolean locked,
    Instant lockedUntil,
    int lockCount,
    boolean active,
    Instant deletedAt,
    Instant createdAt,
    Instant updatedAt) {

  public static UserResponse from(UserRecord user, Instant now) {
    return new UserResponse(
        user.id(),
        user.code(),
        user.name(),
        user.email(),
        user.phone(),
        user.dateOfBirth(),
        user.gender() == null ? null : user.gender().value(),
        user.avatar(),
        user.emailVerifiedAt(),
        user.enabled(),
        user.isLocked(now),
        user.lockedUntil(),
        user.lockCount(),
        user.isActive(now),
        user.deletedAt(),
        user.createdAt(),
        user.updatedAt());
  }
}
