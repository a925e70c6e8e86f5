package paystore.payin.model;

/**
 * Selects one payment method. Priority when several keys are set: {@code id},
 * {@code pgpResourceId}, {@code legacyStripeCardId}.
 */
public record PaymentMethodLookup(String id, String pgpResourceId, Long legacyStripeCardId) {

  public PaymentMethodLookup {
    if (id == null && pgpResourceId == null && legacyStripeCardId == null) {
      throw new IllegalArgumentException(
          "PaymentMethodLookup needs id, pgpResourceId or legacyStripeCardId");
    }
  }

  public static PaymentMethodLookup byId(String id) {
    return new PaymentMethodLookup(id, null, null);
  }

  public static PaymentMethodLookup byPgpResourceId(String pgpResourceId) {
    return new PaymentMethodLookup(null, pgpResourceId, null);
  }

  public static PaymentMethodLookup byLegacyStripeCardId(long legacyStripeCardId) {
    return new PaymentMethodLookup(null, null, legacyStripeCardId);
  }
}
