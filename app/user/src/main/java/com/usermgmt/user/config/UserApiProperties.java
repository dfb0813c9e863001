package com.usermgmt.user.config;

import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "user-api")
public record UserApiProperties(String environment, Pagination pagination) {

  private static final Set<String> PRODUCTION_NAMES = Set.of("production", "prod");

  public UserApiProperties {
    environment = environment == null || environment.isBlank() ? "local" : environment.trim();
    pagination = pagination == null ? new Pagination(0, 0) : pagination;
  }

  /** production では debug ブロックと生の例外メッセージを応答に含めない。 */
  public boolean isProduction() {
    return PRODUCTION_NAMES.contains(environment.toLowerCase(Locale.ROOT));
  }

  public record Pagination(int defaultPerPage, int maxPerPage) {

    public Pagination {
      defaultPerPage = defaultPerPage <= 0 ? 15 : defaultPerPage;
      maxPerPage = maxPerPage <= 0 ? 100 : maxPerPage;
    }

    public int resolvePage(Integer requested) {
      return requested == null || requested < 1 ? 1 : requested;
    }

    public int resolvePerPage(Integer requested) {
      if (requested == null || requested < 1) {
        return defaultPerPage;
      }
      return Math.min(requested, maxPerPage);
    }
  }
}
