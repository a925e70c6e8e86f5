package paystore.client;

import paystore.Secret;

import java.util.Locale;
import java.util.Objects;

/**
 * Credentials of one Stripe platform account, keyed by its two-letter country code.
 */
public record StripeClientSettings(Secret apiKey, String country) {

  public StripeClientSettings {
    Objects.requireNonNull(apiKey, "apiKey");
    Objects.requireNonNull(country, "country");
    country = country.toUpperCase(Locale.ROOT);
  }

  public static StripeClientSettings of(String apiKey, String country) {
    return new StripeClientSettings(Secret.of(apiKey), country);
  }
}
