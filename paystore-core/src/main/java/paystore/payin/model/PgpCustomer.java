package paystore.payin.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted {@code pgp_customers} row: the payer's customer object at one payment gateway
 * provider.
 */
public record PgpCustomer(
    String id,
    String payerId,
    String pgpResourceId,
    String pgpCode,
    String currency,
    String legacyId,
    String legacyStripeCustomerId,
    Long accountBalance,
    String description,
    String defaultPaymentMethodId,
    String legacyDefaultSourceId,
    String legacyDefaultCardId,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt,
    Instant deletedAt
) {
  public PgpCustomer {
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
