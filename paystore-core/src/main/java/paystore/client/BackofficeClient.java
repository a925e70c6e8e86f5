package paystore.client;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Client handle for the internal backoffice API.
 *
 * <p>Holds the service credentials and caches the JWT obtained with them until its configured
 * lifetime expires. The token itself is fetched by a caller-supplied issuer, which keeps the HTTP
 * exchange out of this module.
 */
public final class BackofficeClient {
  private final BackofficeClientSettings settings;
  private final URI baseUri;
  private final Clock clock;

  private String token;
  private Instant tokenExpiresAt = Instant.MIN;

  public BackofficeClient(BackofficeClientSettings settings) {
    this(settings, Clock.systemUTC());
  }

  BackofficeClient(BackofficeClientSettings settings, Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    String base = settings.baseUrl().endsWith("/") ? settings.baseUrl() : settings.baseUrl() + "/";
    this.baseUri = URI.create(base);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public BackofficeClientSettings settings() {
    return settings;
  }

  /**
   * Resolves an API path against the base URL; a leading slash is ignored.
   */
  public URI resolve(String path) {
    String relative = path.startsWith("/") ? path.substring(1) : path;
    return baseUri.resolve(relative);
  }

  /**
   * Returns the cached token, asking {@code issuer} for a new one once the previous token is older
   * than the configured TTL.
   */
  public synchronized String token(Supplier<String> issuer) {
    Instant now = clock.instant();
    if (token == null || !now.isBefore(tokenExpiresAt)) {
      token = Objects.requireNonNull(issuer.get(), "issued token");
      tokenExpiresAt = now.plus(settings.jwtTokenTtl());
    }
    return token;
  }
}
