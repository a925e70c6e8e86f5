package paystore.client;

import paystore.Secret;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of the internal backoffice API: base URL, service user and the lifetime
 * of the JWT issued for that user.
 */
public record BackofficeClientSettings(String baseUrl, String email, Secret password,
    Duration jwtTokenTtl) {

  public BackofficeClientSettings {
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(jwtTokenTtl, "jwtTokenTtl");
    if (jwtTokenTtl.isZero() || jwtTokenTtl.isNegative()) {
      throw new IllegalArgumentException("jwtTokenTtl must be > 0");
    }
  }
}
