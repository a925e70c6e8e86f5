package paystore.payin.model;

/**
 * Selects one legacy Stripe customer by serial id or by Stripe id; {@code id} wins when both are
 * given.
 */
public record StripeCustomerLookup(Long id, String stripeId) {

  public StripeCustomerLookup {
    if (id == null && stripeId == null) {
      throw new IllegalArgumentException("StripeCustomerLookup needs id or stripeId");
    }
  }

  public static StripeCustomerLookup byId(long id) {
    return new StripeCustomerLookup(id, null);
  }

  public static StripeCustomerLookup byStripeId(String stripeId) {
    return new StripeCustomerLookup(null, stripeId);
  }
}
