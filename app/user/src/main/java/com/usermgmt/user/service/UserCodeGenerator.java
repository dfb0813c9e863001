/*
 * どこで: ユーザー作成
 * 何を: 20 桁の数字からなる外部公開用ユーザーコードを生成する
 * なぜ: 連番 ID を公開せずに共有可能な識別子を割り当てるため
 */
package com.usermgmt.user.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;
import java.util.random.RandomGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 役割:
 * - 現在時刻 (yyyyMMddHHmmss) を先頭 14 桁に持つ 20 桁コードを作る。
 *
 * 期待動作:
 * - シードは数字のみ抽出し、時刻ベースで始まる場合だけ採用する。
 * - 既存コードと衝突したら末尾を振り直す (最大 5 回 + 末尾 2 桁の差し替え)。
 * - 事前チェックは同時作成との競合を防げないため、最終的な一意性は DB 制約が担う。
 */
@Component
public class UserCodeGenerator {

  static final int CODE_LENGTH = 20;
  static final int BASE_LENGTH = 14;
  static final int MAX_RETRIES = 5;

  private static final DateTimeFormatter BASE_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

  private final Clock clock;
  private final RandomGenerator random;

  @Autowired
  public UserCodeGenerator(Clock clock) {
    this(clock, new SecureRandom());
  }

  UserCodeGenerator(Clock clock, RandomGenerator random) {
    this.clock = clock;
    this.random = random;
  }

  public String generate(Predicate<String> codeExists) {
    return generate(null, codeExists);
  }

  public String generate(String seed, Predicate<String> codeExists) {
    final String base = LocalDateTime.now(clock).format(BASE_FORMAT);
    String code = padToLength(initialCandidate(base, seed));

    if (codeExists.test(code)) {
      final int suffixLength = Math.min(6, CODE_LENGTH - BASE_LENGTH);
      boolean unique = false;
      for (int attempt = 0; attempt < MAX_RETRIES && !unique; attempt++) {
        code = padToLength(base + randomDigits(suffixLength));
        unique = !codeExists.test(code);
      }
      if (!unique) {
        code =
            code.length() < CODE_LENGTH
                ? padToLength(code)
                : code.substring(0, CODE_LENGTH - 2) + randomDigits(2);
        if (codeExists.test(code)) {
          throw new IllegalStateException("unable to generate a unique user code");
        }
      }
    }
    return code;
  }

  private static String initialCandidate(String base, String seed) {
    if (seed == null) {
      return base;
    }
    final String digits = seed.replaceAll("\\D", "");
    if (digits.isEmpty()) {
      return base;
    }
    final String truncated =
        digits.length() > CODE_LENGTH ? digits.substring(0, CODE_LENGTH) : digits;
    if (truncated.length() < BASE_LENGTH || !truncated.startsWith(base)) {
      return base;
    }
    return truncated;
  }

  private String padToLength(String value) {
    if (value.length() >= CODE_LENGTH) {
      return value.substring(0, CODE_LENGTH);
    }
    return value + randomDigits(CODE_LENGTH - value.length());
  }

  private String randomDigits(int length) {
    final StringBuilder digits = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      digits.append((char) ('0' + random.nextInt(10)));
    }
    return digits.toString();
  }
}
