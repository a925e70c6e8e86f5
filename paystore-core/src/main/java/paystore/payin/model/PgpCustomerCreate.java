package paystore.payin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Insert input for a gateway customer. {@code id}, {@code payerId}, {@code pgpResourceId} and
 * {@code pgpCode} are required.
 */
public record PgpCustomerCreate(
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
    Map<String, Object> metadata
) {
  public PgpCustomerCreate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(payerId, "payerId");
    Objects.requireNonNull(pgpResourceId, "pgpResourceId");
    Objects.requireNonNull(pgpCode, "pgpCode");
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String id;
    private String payerId;
    private String pgpResourceId;
    private String pgpCode;
    private String currency;
    private String legacyId;
    private String legacyStripeCustomerId;
    private Long accountBalance;
    private String description;
    private String defaultPaymentMethodId;
    private String legacyDefaultSourceId;
    private String legacyDefaultCardId;
    private Map<String, Object> metadata;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder payerId(String payerId) {
      this.payerId = payerId;
      return this;
    }

    public Builder pgpResourceId(String pgpResourceId) {
      this.pgpResourceId = pgpResourceId;
      return this;
    }

    public Builder pgpCode(String pgpCode) {
      this.pgpCode = pgpCode;
      return this;
    }

    public Builder currency(String currency) {
      this.currency = currency;
      return this;
    }

    public Builder legacyId(String legacyId) {
      this.legacyId = legacyId;
      return this;
    }

    public Builder legacyStripeCustomerId(String legacyStripeCustomerId) {
      this.legacyStripeCustomerId = legacyStripeCustomerId;
      return this;
    }

    public Builder accountBalance(Long accountBalance) {
      this.accountBalance = accountBalance;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder defaultPaymentMethodId(String defaultPaymentMethodId) {
      this.defaultPaymentMethodId = defaultPaymentMethodId;
      return this;
    }

    public Builder legacyDefaultSourceId(String legacyDefaultSourceId) {
      this.legacyDefaultSourceId = legacyDefaultSourceId;
      return this;
    }

    public Builder legacyDefaultCardId(String legacyDefaultCardId) {
      this.legacyDefaultCardId = legacyDefaultCardId;
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      this.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
      return this;
    }

    public PgpCustomerCreate build() {
      return new PgpCustomerCreate(id, payerId, pgpResourceId, pgpCode, currency, legacyId,
          legacyStripeCustomerId, accountBalance, description, defaultPaymentMethodId,
          legacyDefaultSourceId, legacyDefaultCardId, metadata);
    }
  }
}
