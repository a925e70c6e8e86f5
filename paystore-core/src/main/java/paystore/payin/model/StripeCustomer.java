package paystore.payin.model;

/**
 * A persisted row of the legacy {@code stripe_customer} table in the payin main database.
 */
public record StripeCustomer(
    long id,
    String stripeId,
    String countryShortname,
    String ownerType,
    long ownerId,
    String defaultCard,
    String defaultSource
) {
}
