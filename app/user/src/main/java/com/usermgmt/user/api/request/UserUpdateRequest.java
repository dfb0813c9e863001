/*
 * どこで: User API DTO
 * 何を: PUT /users/{id} の入力 DTO
 * なぜ: 更新可能な項目を許可リストとして限定し、未知のキーを反映しないため
 */
package com.usermgmt.user.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.Objects;

/** null の項目は変更しない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserUpdateRequest(
    @Size(min = 1, max = 255) String name,
    @Email @Size(max = 255) String email,
    @Size(min = 8, max = 255) String password,
    String passwordConfirmation,
    @Size(max = 20) String phone,
    @Past LocalDate dateOfBirth,
    @Pattern(regexp = "male|female|other") String gender,
    @Pattern(regexp = "https?://\\S+") @Size(max = 2048) String avatar) {

  public boolean passwordConfirmed() {
    return password == null || Objects.equals(password, passwordConfirmation);
  }
}
