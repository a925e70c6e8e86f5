package paystore.db;

/**
 * Unchecked exception wrapping a JDBC failure against a logical database.
 *
 * <p>Subclasses classify the failures callers react to differently:
 * {@link DatabaseConnectionException} and {@link IntegrityViolationException}.
 */
public class DatabaseException extends RuntimeException {
  private final String databaseId;

  public DatabaseException(String databaseId, String message, Throwable cause) {
    super(message, cause);
    this.databaseId = databaseId;
  }

  /**
   * Logical database the failure happened on.
   */
  public String databaseId() {
    return databaseId;
  }
}
