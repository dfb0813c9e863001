/*
 * どこで: app/user/src/main/java/com/usermgmt/user/model/UserRecord.java
 * 何を: users テーブル相当のドメインレコード
 * なぜ: API/Service/Repository 間でユーザー情報の受け渡しを明確にするため
 */
package com.usermgmt.user.model;

import java.time.Instant;
import java.time.LocalDate;

public record UserRecord(
    Long id,
    String code,
    String name,
    String email,
    String passwordHash,
    String phone,
    LocalDate dateOfBirth,
    Gender gender,
    String avatar,
    Instant emailVerifiedAt,
    boolean enabled,
    Instant lockedUntil,
    int lockCount,
    Instant deletedAt,
    Long createdBy,
    Long updatedBy,
    Long deletedBy,
    Instant createdAt,
    Instant updatedAt) {

  /** ロック期限が未来にある間だけロック中とみなす。 */
  public boolean isLocked(Instant now) {
    return lockedUntil != null && lockedUntil.isAfter(now);
  }

  public boolean isActive(Instant now) {
    return enabled && !isLocked(now);
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public UserRecord withProfile(
      String name,
      String email,
      String passwordHash,
      String phone,
      LocalDate dateOfBirth,
      Gender gender,
      String avatar,
      Long updatedBy) {
    return new UserRecord(
        id, code, name, email, passwordHash, phone, dateOfBirth, gender, avatar, emailVerifiedAt,
        enabled, lockedUntil, lockCount, deletedAt, createdBy, updatedBy, deletedBy, createdAt,
        updatedAt);
  }
}
