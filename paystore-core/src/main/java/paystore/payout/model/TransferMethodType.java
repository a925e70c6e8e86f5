package paystore.payout.model;

import java.util.Locale;

/**
 * Payout rail a transfer was submitted through, stored in {@code transfers.method}.
 */
public enum TransferMethodType {
  STRIPE("stripe"),
  DOORDASH_PAY("doordash_pay");

  private final String value;

  TransferMethodType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * @throws IllegalArgumentException if {@code value} is not a known method
   */
  public static TransferMethodType fromValue(String value) {
    String normalized = value.toLowerCase(Locale.ROOT);
    for (TransferMethodType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown transfer method: " + value);
  }
}
