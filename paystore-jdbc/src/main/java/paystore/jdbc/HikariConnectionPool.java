package paystore.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import paystore.spi.ConnectionPool;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionPool} backed by a {@link HikariDataSource}.
 */
public final class HikariConnectionPool implements ConnectionPool {
  private final HikariDataSource dataSource;

  public HikariConnectionPool(HikariDataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public String name() {
    return dataSource.getPoolName();
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  /** The underlying data source, for pool metrics and diagnostics. */
  public HikariDataSource dataSource() {
    return dataSource;
  }

  @Override
  public void close() {
    dataSource.close();
  }
}
