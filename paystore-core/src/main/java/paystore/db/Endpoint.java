package paystore.db;

import paystore.Secret;

import java.util.Objects;

/**
 * JDBC URL plus optional credentials for one master or replica endpoint.
 */
public record Endpoint(String jdbcUrl, String username, Secret password) {

  public Endpoint {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    if (jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("jdbcUrl must not be blank");
    }
  }

  /** Endpoint whose credentials are embedded in the URL or not required. */
  public static Endpoint of(String jdbcUrl) {
    return new Endpoint(jdbcUrl, null, null);
  }

  /** Same credentials, different URL. */
  public Endpoint withUrl(String otherUrl) {
    return new Endpoint(otherUrl, username, password);
  }
}
