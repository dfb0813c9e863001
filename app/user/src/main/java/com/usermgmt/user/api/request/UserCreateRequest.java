/*
 * どこで: User API DTO
 * 何を: POST /users の入力 DTO
 * なぜ: 作成時に受け付ける項目と入力制約を明示するため
 */
package com.usermgmt.user.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.Objects;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserCreateRequest(
    @NotBlank @Size(max = 255) String name,
    @NotBlank @Email @Size(max = 255) String email,
    @NotBlank @Size(min = 8, max = 255) String password,
    @NotBlank String passwordConfirmation,
    @Size(max = 20) String phone,
    @Past LocalDate dateOfBirth,
    @Pattern(regexp = "male|female|other") String gender,
    @Pattern(regexp = "https?://\\S+") @Size(max = 2048) String avatar,
    Boolean enabled) {

  public boolean passwordConfirmed() {
    return Objects.equals(password, passwordConfirmation);
  }
}
