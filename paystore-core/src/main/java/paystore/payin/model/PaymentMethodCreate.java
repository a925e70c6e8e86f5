package paystore.payin.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Insert input for a payment method. {@code id}, {@code pgpCode} and {@code pgpResourceId} are
 * required.
 */
public record PaymentMethodCreate(
    String id,
    String payerId,
    String pgpCode,
    String pgpResourceId,
    Long legacyConsumerId,
    Long legacyStripeCardId,
    String type,
    String object,
    Instant attachedAt
) {
  public PaymentMethodCreate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(pgpCode, "pgpCode");
    Objects.requireNonNull(pgpResourceId, "pgpResourceId");
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String id;
    private String payerId;
    private String pgpCode;
    private String pgpResourceId;
    private Long legacyConsumerId;
    private Long legacyStripeCardId;
    private String type;
    private String object;
    private Instant attachedAt;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder payerId(String payerId) {
      this.payerId = payerId;
      return this;
    }

    public Builder pgpCode(String pgpCode) {
      this.pgpCode = pgpCode;
      return this;
    }

    public Builder pgpResourceId(String pgpResourceId) {
      this.pgpResourceId = pgpResourceId;
      return this;
    }

    public Builder legacyConsumerId(Long legacyConsumerId) {
      this.legacyConsumerId = legacyConsumerId;
      return this;
    }

    public Builder legacyStripeCardId(Long legacyStripeCardId) {
      this.legacyStripeCardId = legacyStripeCardId;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder object(String object) {
      this.object = object;
      return this;
    }

    public Builder attachedAt(Instant attachedAt) {
      this.attachedAt = attachedAt;
      return this;
    }

    public PaymentMethodCreate build() {
      return new PaymentMethodCreate(id, payerId, pgpCode, pgpResourceId, legacyConsumerId,
          legacyStripeCardId, type, object, attachedAt);
    }
  }
}
