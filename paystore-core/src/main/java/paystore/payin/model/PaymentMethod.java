package paystore.payin.model;

import java.time.Instant;

/**
 * A persisted {@code pgp_payment_methods} row. {@code payerId} is null until the method is
 * attached to a payer.
 */
public record PaymentMethod(
    String id,
    String payerId,
    String pgpCode,
    String pgpResourceId,
    Long legacyConsumerId,
    Long legacyStripeCardId,
    String type,
    String object,
    Instant attachedAt,
    Instant detachedAt,
    Instant createdAt,
    Instant updatedAt,
    Instant deletedAt
) {

  public boolean isDeleted() {
    return deletedAt != null;
  }
}
