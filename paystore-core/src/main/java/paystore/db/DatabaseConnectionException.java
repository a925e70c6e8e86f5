package paystore.db;

/**
 * A pool could not be opened or closed, a connection could not be acquired in time, or the
 * connection broke mid-statement.
 *
 * <p>Fatal during startup. Repositories never retry it; retry policy belongs to the caller.
 */
public final class DatabaseConnectionException extends DatabaseException {
  public DatabaseConnectionException(String databaseId, String message, Throwable cause) {
    super(databaseId, message, cause);
  }
}
