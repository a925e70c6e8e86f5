package paystore.payin.model;

import paystore.model.FieldUpdate;

/**
 * Set-clause of a legacy Stripe customer update.
 */
public record StripeCustomerUpdate(FieldUpdate<String> defaultCard, FieldUpdate<String> defaultSource) {

  public StripeCustomerUpdate {
    defaultCard = defaultCard == null ? FieldUpdate.absent() : defaultCard;
    defaultSource = defaultSource == null ? FieldUpdate.absent() : defaultSource;
  }

  public static StripeCustomerUpdate defaultCard(String defaultCard) {
    return new StripeCustomerUpdate(FieldUpdate.of(defaultCard), FieldUpdate.absent());
  }

  public static StripeCustomerUpdate defaultSource(String defaultSource) {
    return new StripeCustomerUpdate(FieldUpdate.absent(), FieldUpdate.of(defaultSource));
  }

  public StripeCustomerUpdate withDefaultSource(String defaultSource) {
    return new StripeCustomerUpdate(defaultCard, FieldUpdate.of(defaultSource));
  }
}
