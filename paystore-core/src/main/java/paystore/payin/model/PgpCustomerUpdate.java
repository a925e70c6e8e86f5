package paystore.payin.model;

import paystore.model.FieldUpdate;

import java.time.Instant;

/**
 * Set-clause of a gateway customer update: default payment instrument pointers and
 * {@code updated_at}.
 */
public final class PgpCustomerUpdate {
  private final FieldUpdate<String> defaultPaymentMethodId;
  private final FieldUpdate<String> legacyDefaultSourceId;
  private final FieldUpdate<String> legacyDefaultCardId;
  private final FieldUpdate<Instant> updatedAt;

  private PgpCustomerUpdate(Builder builder) {
    this.defaultPaymentMethodId = builder.defaultPaymentMethodId;
    this.legacyDefaultSourceId = builder.legacyDefaultSourceId;
    this.legacyDefaultCardId = builder.legacyDefaultCardId;
    this.updatedAt = builder.updatedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  public FieldUpdate<String> defaultPaymentMethodId() {
    return defaultPaymentMethodId;
  }

  public FieldUpdate<String> legacyDefaultSourceId() {
    return legacyDefaultSourceId;
  }

  public FieldUpdate<String> legacyDefaultCardId() {
    return legacyDefaultCardId;
  }

  public FieldUpdate<Instant> updatedAt() {
    return updatedAt;
  }

  public static final class Builder {
    private FieldUpdate<String> defaultPaymentMethodId = FieldUpdate.absent();
    private FieldUpdate<String> legacyDefaultSourceId = FieldUpdate.absent();
    private FieldUpdate<String> legacyDefaultCardId = FieldUpdate.absent();
    private FieldUpdate<Instant> updatedAt = FieldUpdate.absent();

    private Builder() {}

    public Builder defaultPaymentMethodId(String defaultPaymentMethodId) {
      this.defaultPaymentMethodId = FieldUpdate.of(defaultPaymentMethodId);
      return this;
    }

    public Builder legacyDefaultSourceId(String legacyDefaultSourceId) {
      this.legacyDefaultSourceId = FieldUpdate.of(legacyDefaultSourceId);
      return this;
    }

    public Builder legacyDefaultCardId(String legacyDefaultCardId) {
      this.legacyDefaultCardId = FieldUpdate.of(legacyDefaultCardId);
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = FieldUpdate.of(updatedAt);
      return this;
    }

    public PgpCustomerUpdate build() {
      return new PgpCustomerUpdate(this);
    }
  }
}
