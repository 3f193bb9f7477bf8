package dev.harvester.api;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Bearer-token protection of the task endpoints, bound from {@code harvester.auth.*}.
 *
 * @param enabled require a bearer token on {@code /crawl} and {@code /task/**}
 * @param token the expected token; must be set when {@code enabled}
 */
@ConfigurationProperties(prefix = "harvester.auth")
public record AuthProperties(@DefaultValue("true") boolean enabled, @Nullable String token) {

  public AuthProperties {
    if (enabled && (token == null || token.isBlank())) {
      throw new IllegalStateException(
          "harvester.auth.token must be set when harvester.auth.enabled is true");
    }
  }
}
