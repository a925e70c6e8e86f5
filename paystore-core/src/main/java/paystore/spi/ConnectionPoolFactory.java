package paystore.spi;

import paystore.db.DatabaseConfig;
import paystore.db.Endpoint;

/**
 * Opens connection pools for {@link paystore.db.Database} handles.
 *
 * <p>Implementations must either return a pool that has established at least one connection or
 * throw; a pool that silently defers connecting would let a broken database pass startup.
 */
@FunctionalInterface
public interface ConnectionPoolFactory {

  /**
   * Opens a pool against the given endpoint.
   *
   * @param poolName name for logs and metrics
   * @param endpoint JDBC URL and credentials
   * @param config   sizing and timeouts
   * @return the open pool
   * @throws RuntimeException if the endpoint cannot be reached
   */
  ConnectionPool open(String poolName, Endpoint endpoint, DatabaseConfig config);
}
