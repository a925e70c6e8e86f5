package paystore.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * An open pool of JDBC connections to one endpoint of a logical database.
 *
 * <p>Callers are responsible for closing every connection they borrow.
 *
 * @see ConnectionPoolFactory
 */
public interface ConnectionPool extends AutoCloseable {

  /**
   * Pool name used in logs and metrics, e.g. {@code payout_maindb-master}.
   */
  String name();

  /**
   * Borrows a connection, waiting at most the configured acquire timeout.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if no connection could be obtained in time
   */
  Connection getConnection() throws SQLException;

  /**
   * Closes every connection held by the pool. Connections borrowed afterwards fail.
   */
  @Override
  void close();
}
