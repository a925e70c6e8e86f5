package paystore.db;

import java.util.Locale;

/**
 * The logical databases owned by an {@link paystore.AppContext}, in startup order.
 *
 * <p>The {@code *_MAINDB} entries are copies of the same legacy main database and share the
 * alternative replica picked once per context.
 */
public enum DatabaseId {
  PAYOUT_MAINDB(true),
  PAYOUT_BANKDB(false),
  PAYIN_MAINDB(true),
  PAYIN_PAYMENTDB(false),
  LEDGER_MAINDB(true),
  LEDGER_PAYMENTDB(false);

  private final boolean usesMaindbReplica;

  DatabaseId(boolean usesMaindbReplica) {
    this.usesMaindbReplica = usesMaindbReplica;
  }

  /**
   * Whether handles for this database take the context-wide alternative replica.
   */
  public boolean usesMaindbReplica() {
    return usesMaindbReplica;
  }

  /**
   * Identifier used in logs, pool names and metric tags, e.g. {@code payin_paymentdb}.
   */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves {@code payin_paymentdb}, {@code payin-paymentdb} or {@code PAYIN_PAYMENTDB}.
   *
   * @throws IllegalArgumentException if the name matches no database
   */
  public static DatabaseId fromName(String name) {
    String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (DatabaseId id : values()) {
      if (id.name().equals(normalized)) {
        return id;
      }
    }
    throw new IllegalArgumentException("Unknown database: " + name);
  }
}
