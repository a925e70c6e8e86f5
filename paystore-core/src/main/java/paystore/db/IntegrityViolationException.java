package paystore.db;

/**
 * A write violated a uniqueness, foreign-key, not-null or check constraint (SQL state class
 * {@code 23}).
 */
public final class IntegrityViolationException extends DatabaseException {
  private final String sqlState;

  public IntegrityViolationException(String databaseId, String message, String sqlState, Throwable cause) {
    super(databaseId, message, cause);
    this.sqlState = sqlState;
  }

  /** Five-character SQL state reported by the driver, e.g. {@code 23505}. */
  public String sqlState() {
    return sqlState;
  }
}
