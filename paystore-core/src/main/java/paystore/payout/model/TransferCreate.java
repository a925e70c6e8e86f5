package paystore.payout.model;

import java.util.Objects;

/**
 * Insert input for a transfer. The id is assigned by the database and {@code created_at} by the
 * repository.
 */
public record TransferCreate(
    long subtotal,
    long adjustments,
    long amount,
    String method,
    String currency,
    String status,
    Long paymentAccountId,
    Long recipientId,
    String statementDescription,
    String manualTransferReason,
    Boolean shouldRetryOnFailure
) {
  public TransferCreate {
    Objects.requireNonNull(method, "method");
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private long subtotal;
    private long adjustments;
    private long amount;
    private String method;
    private String currency;
    private String status;
    private Long paymentAccountId;
    private Long recipientId;
    private String statementDescription;
    private String manualTransferReason;
    private Boolean shouldRetryOnFailure;

    private Builder() {}

    public Builder subtotal(long subtotal) {
      this.subtotal = subtotal;
      return this;
    }

    public Builder adjustments(long adjustments) {
      this.adjustments = adjustments;
      return this;
    }

    public Builder amount(long amount) {
      this.amount = amount;
      return this;
    }

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder method(TransferMethodType method) {
      this.method = method.value();
      return this;
    }

    public Builder currency(String currency) {
      this.currency = currency;
      return this;
    }

    public Builder status(String status) {
      this.status = status;
      return this;
    }

    public Builder paymentAccountId(Long paymentAccountId) {
      this.paymentAccountId = paymentAccountId;
      return this;
    }

    public Builder recipientId(Long recipientId) {
      this.recipientId = recipientId;
      return this;
    }

    public Builder statementDescription(String statementDescription) {
      this.statementDescription = statementDescription;
      return this;
    }

    public Builder manualTransferReason(String manualTransferReason) {
      this.manualTransferReason = manualTransferReason;
      return this;
    }

    public Builder shouldRetryOnFailure(Boolean shouldRetryOnFailure) {
      this.shouldRetryOnFailure = shouldRetryOnFailure;
      return this;
    }

    public TransferCreate build() {
      return new TransferCreate(subtotal, adjustments, amount, method, currency, status,
          paymentAccountId, recipientId, statementDescription, manualTransferReason,
          shouldRetryOnFailure);
    }
  }
}
