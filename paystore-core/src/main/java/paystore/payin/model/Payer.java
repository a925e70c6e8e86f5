package paystore.payin.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted {@code payers} row.
 */
public record Payer(
    String id,
    String payerType,
    String country,
    String legacyStripeCustomerId,
    Long accountBalance,
    String description,
    String ddPayerId,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt,
    Instant deletedAt
) {
  public Payer {
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
