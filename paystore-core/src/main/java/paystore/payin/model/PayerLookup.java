package paystore.payin.model;

/**
 * Selects one payer by exactly one of its keys. When several keys are set the repository uses the
 * first in priority order: {@code id}, {@code legacyStripeCustomerId}, {@code ddPayerId}.
 */
public record PayerLookup(String id, String legacyStripeCustomerId, String ddPayerId) {

  public PayerLookup {
    if (id == null && legacyStripeCustomerId == null && ddPayerId == null) {
      throw new IllegalArgumentException("PayerLookup needs id, legacyStripeCustomerId or ddPayerId");
    }
  }

  public static PayerLookup byId(String id) {
    return new PayerLookup(id, null, null);
  }

  public static PayerLookup byLegacyStripeCustomerId(String legacyStripeCustomerId) {
    return new PayerLookup(null, legacyStripeCustomerId, null);
  }

  public static PayerLookup byDdPayerId(String ddPayerId) {
    return new PayerLookup(null, null, ddPayerId);
  }
}
