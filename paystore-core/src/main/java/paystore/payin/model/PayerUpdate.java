package paystore.payin.model;

import paystore.model.FieldUpdate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Set-clause of a payer update. Columns left absent are not written.
 */
public final class PayerUpdate {
  private final FieldUpdate<String> description;
  private final FieldUpdate<Long> accountBalance;
  private final FieldUpdate<String> legacyStripeCustomerId;
  private final FieldUpdate<Map<String, Object>> metadata;
  private final FieldUpdate<Instant> updatedAt;
  private final FieldUpdate<Instant> deletedAt;

  private PayerUpdate(Builder builder) {
    this.description = builder.description;
    this.accountBalance = builder.accountBalance;
    this.legacyStripeCustomerId = builder.legacyStripeCustomerId;
    this.metadata = builder.metadata;
    this.updatedAt = builder.updatedAt;
    this.deletedAt = builder.deletedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  public FieldUpdate<String> description() {
    return description;
  }

  public FieldUpdate<Long> accountBalance() {
    return accountBalance;
  }

  public FieldUpdate<String> legacyStripeCustomerId() {
    return legacyStripeCustomerId;
  }

  public FieldUpdate<Map<String, Object>> metadata() {
    return metadata;
  }

  public FieldUpdate<Instant> updatedAt() {
    return updatedAt;
  }

  public FieldUpdate<Instant> deletedAt() {
    return deletedAt;
  }

  /** Builder for {@link PayerUpdate}. Every column starts absent. */
  public static final class Builder {
    private FieldUpdate<String> description = FieldUpdate.absent();
    private FieldUpdate<Long> accountBalance = FieldUpdate.absent();
    private FieldUpdate<String> legacyStripeCustomerId = FieldUpdate.absent();
    private FieldUpdate<Map<String, Object>> metadata = FieldUpdate.absent();
    private FieldUpdate<Instant> updatedAt = FieldUpdate.absent();
    private FieldUpdate<Instant> deletedAt = FieldUpdate.absent();

    private Builder() {}

    public Builder description(String description) {
      this.description = FieldUpdate.of(description);
      return this;
    }

    public Builder accountBalance(Long accountBalance) {
      this.accountBalance = FieldUpdate.of(accountBalance);
      return this;
    }

    public Builder legacyStripeCustomerId(String legacyStripeCustomerId) {
      this.legacyStripeCustomerId = FieldUpdate.of(legacyStripeCustomerId);
      return this;
    }

    public Builder metadata(Map<String, ?> metadata) {
      Map<String, Object> copy = metadata == null ? null : new LinkedHashMap<>(metadata);
      this.metadata = FieldUpdate.of(copy);
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = FieldUpdate.of(updatedAt);
      return this;
    }

    public Builder deletedAt(Instant deletedAt) {
      this.deletedAt = FieldUpdate.of(deletedAt);
      return this;
    }

    public PayerUpdate build() {
      return new PayerUpdate(this);
    }
  }
}
