package paystore.db;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Translates {@link SQLException}s into the {@link DatabaseException} hierarchy.
 */
public final class SqlErrors {

  /**
   * Classifies a driver exception. The original exception is kept as the cause.
   *
   * @param databaseId logical database the statement ran against
   * @param operation  short description used in the message, e.g. {@code "fetchOne"}
   * @param e          the driver exception
   * @return the exception to throw
   */
  public static DatabaseException translate(String databaseId, String operation, SQLException e) {
    String state = sqlState(e);
    String message = "Failed to execute " + operation + " on " + databaseId
        + (state == null ? "" : " (SQLState " + state + ")");
    if (isIntegrityViolation(e, state)) {
      return new IntegrityViolationException(databaseId, message, state, e);
    }
    if (isConnectionFailure(e, state)) {
      return new DatabaseConnectionException(databaseId, message, e);
    }
    return new DatabaseException(databaseId, message, e);
  }

  static boolean isIntegrityViolation(SQLException e, String state) {
    return e instanceof SQLIntegrityConstraintViolationException
        || (state != null && state.startsWith("23"));
  }

  static boolean isConnectionFailure(SQLException e, String state) {
    return e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException
        || e instanceof SQLTimeoutException
        || (state != null && state.startsWith("08"));
  }

  // Drivers sometimes leave the state on a chained exception only.
  private static String sqlState(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if (cur.getSQLState() != null) {
        return cur.getSQLState();
      }
    }
    return null;
  }

  private SqlErrors() {}
}
