package paystore.payout.model;

import paystore.model.FieldUpdate;

import java.time.Instant;

/**
 * Set-clause of a transfer update.
 */
public final class TransferUpdate {
  private final FieldUpdate<String> status;
  private final FieldUpdate<String> statusCode;
  private final FieldUpdate<String> method;
  private final FieldUpdate<Instant> submittingAt;
  private final FieldUpdate<Instant> submittedAt;
  private final FieldUpdate<Instant> deletedAt;
  private final FieldUpdate<String> manualTransferReason;

  private TransferUpdate(Builder builder) {
    this.status = builder.status;
    this.statusCode = builder.statusCode;
    this.method = builder.method;
    this.submittingAt = builder.submittingAt;
    this.submittedAt = builder.submittedAt;
    this.deletedAt = builder.deletedAt;
    this.manualTransferReason = builder.manualTransferReason;
  }

  public static Builder builder() {
    return new Builder();
  }

  public FieldUpdate<String> status() {
    return status;
  }

  public FieldUpdate<String> statusCode() {
    return statusCode;
  }

  public FieldUpdate<String> method() {
    return method;
  }

  public FieldUpdate<Instant> submittingAt() {
    return submittingAt;
  }

  public FieldUpdate<Instant> submittedAt() {
    return submittedAt;
  }

  public FieldUpdate<Instant> deletedAt() {
    return deletedAt;
  }

  public FieldUpdate<String> manualTransferReason() {
    return manualTransferReason;
  }

  public static final class Builder {
    private FieldUpdate<String> status = FieldUpdate.absent();
    private FieldUpdate<String> statusCode = FieldUpdate.absent();
    private FieldUpdate<String> method = FieldUpdate.absent();
    private FieldUpdate<Instant> submittingAt = FieldUpdate.absent();
    private FieldUpdate<Instant> submittedAt = FieldUpdate.absent();
    private FieldUpdate<Instant> deletedAt = FieldUpdate.absent();
    private FieldUpdate<String> manualTransferReason = FieldUpdate.absent();

    private Builder() {}

    public Builder status(String status) {
      this.status = FieldUpdate.of(status);
      return this;
    }

    public Builder statusCode(String statusCode) {
      this.statusCode = FieldUpdate.of(statusCode);
      return this;
    }

    public Builder method(TransferMethodType method) {
      this.method = FieldUpdate.of(method == null ? null : method.value());
      return this;
    }

    public Builder submittingAt(Instant submittingAt) {
      this.submittingAt = FieldUpdate.of(submittingAt);
      return this;
    }

    public Builder submittedAt(Instant submittedAt) {
      this.submittedAt = FieldUpdate.of(submittedAt);
      return this;
    }

    public Builder deletedAt(Instant deletedAt) {
      this.deletedAt = FieldUpdate.of(deletedAt);
      return this;
    }

    public Builder manualTransferReason(String manualTransferReason) {
      this.manualTransferReason = FieldUpdate.of(manualTransferReason);
      return this;
    }

    public TransferUpdate build() {
      return new TransferUpdate(this);
    }
  }
}
