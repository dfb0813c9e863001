/*
 * どこで: User API
 * 何を: ゲートウェイが転送した利用者自身の情報を返す
 * なぜ: クライアントが自分のコードや状態を ID を知らずに取得できるようにするため
 */
package com.usermgmt.user.api;

import com.usermgmt.user.api.response.ApiResponderFactory;
import com.usermgmt.user.api.response.ResponseEnvelope;
import com.usermgmt.user.api.response.UserResponse;
import com.usermgmt.user.service.UserService;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CurrentUserController {

  private final UserService userService;
  private final ApiResponderFactory responders;
  private final Clock clock;

  /** 未認証または該当ユーザーなしの場合も 200 で data を省略して返す。 */
  @GetMapping("/user")
  public ResponseEntity<ResponseEnvelope> currentUser() {
    final UserResponse user =
        currentUserId()
            .flatMap(userService::findById)
            .map(record -> UserResponse.from(record, clock.instant()))
            .orElse(null);
    return responders.create().withRequestCorrelationId().success(user);
  }

  private static Optional<Long> currentUserId() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(authentication.getName()));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }
}
