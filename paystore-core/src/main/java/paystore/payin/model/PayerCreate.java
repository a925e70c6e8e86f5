package paystore.payin.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Insert input for a payer. The caller assigns the id; timestamps are set by the repository.
 */
public record PayerCreate(
    String id,
    String payerType,
    String country,
    String legacyStripeCustomerId,
    Long accountBalance,
    String description,
    String ddPayerId,
    Map<String, Object> metadata
) {
  public PayerCreate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(payerType, "payerType");
    Objects.requireNonNull(country, "country");
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link PayerCreate}. {@code id}, {@code payerType} and {@code country} are required. */
  public static final class Builder {
    private String id;
    private String payerType;
    private String country;
    private String legacyStripeCustomerId;
    private Long accountBalance;
    private String description;
    private String ddPayerId;
    private Map<String, Object> metadata;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder payerType(String payerType) {
      this.payerType = payerType;
      return this;
    }

    public Builder country(String country) {
      this.country = country;
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

    public Builder ddPayerId(String ddPayerId) {
      this.ddPayerId = ddPayerId;
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      this.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
      return this;
    }

    public PayerCreate build() {
      return new PayerCreate(id, payerType, country, legacyStripeCustomerId, accountBalance,
          description, ddPayerId, metadata);
    }
  }
}
