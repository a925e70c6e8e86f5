package paystore.payin.model;

import paystore.model.FieldUpdate;

import java.time.Instant;

/**
 * Set-clause of a payment method update: attach/detach bookkeeping and soft delete.
 */
public final class PaymentMethodUpdate {
  private final FieldUpdate<String> payerId;
  private final FieldUpdate<Instant> attachedAt;
  private final FieldUpdate<Instant> detachedAt;
  private final FieldUpdate<Instant> deletedAt;
  private final FieldUpdate<Instant> updatedAt;

  private PaymentMethodUpdate(Builder builder) {
    this.payerId = builder.payerId;
    this.attachedAt = builder.attachedAt;
    this.detachedAt = builder.detachedAt;
    this.deletedAt = builder.deletedAt;
    this.updatedAt = builder.updatedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  public FieldUpdate<String> payerId() {
    return payerId;
  }

  public FieldUpdate<Instant> attachedAt() {
    return attachedAt;
  }

  public FieldUpdate<Instant> detachedAt() {
    return detachedAt;
  }

  public FieldUpdate<Instant> deletedAt() {
    return deletedAt;
  }

  public FieldUpdate<Instant> updatedAt() {
    return updatedAt;
  }

  public static final class Builder {
    private FieldUpdate<String> payerId = FieldUpdate.absent();
    private FieldUpdate<Instant> attachedAt = FieldUpdate.absent();
    private FieldUpdate<Instant> detachedAt = FieldUpdate.absent();
    private FieldUpdate<Instant> deletedAt = FieldUpdate.absent();
    private FieldUpdate<Instant> updatedAt = FieldUpdate.absent();

    private Builder() {}

    public Builder payerId(String payerId) {
      this.payerId = FieldUpdate.of(payerId);
      return this;
    }

    public Builder attachedAt(Instant attachedAt) {
      this.attachedAt = FieldUpdate.of(attachedAt);
      return this;
    }

    public Builder detachedAt(Instant detachedAt) {
      this.detachedAt = FieldUpdate.of(detachedAt);
      return this;
    }

    public Builder deletedAt(Instant deletedAt) {
      this.deletedAt = FieldUpdate.of(deletedAt);
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = FieldUpdate.of(updatedAt);
      return this;
    }

    public PaymentMethodUpdate build() {
      return new PaymentMethodUpdate(this);
    }
  }
}
