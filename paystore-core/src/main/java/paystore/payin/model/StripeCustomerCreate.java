package paystore.payin.model;

import java.util.Objects;

/**
 * Insert input for a legacy Stripe customer. The id is assigned by the database.
 */
public record StripeCustomerCreate(
    String stripeId,
    String countryShortname,
    String ownerType,
    long ownerId,
    String defaultCard,
    String defaultSource
) {
  public StripeCustomerCreate {
    Objects.requireNonNull(stripeId, "stripeId");
    Objects.requireNonNull(countryShortname, "countryShortname");
    Objects.requireNonNull(ownerType, "ownerType");
  }
}
