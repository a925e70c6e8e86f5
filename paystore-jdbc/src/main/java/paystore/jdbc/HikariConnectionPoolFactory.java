package paystore.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import paystore.db.DatabaseConfig;
import paystore.db.Endpoint;
import paystore.spi.ConnectionPool;
import paystore.spi.ConnectionPoolFactory;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens one HikariCP pool per endpoint.
 *
 * <p>Pools are created eagerly: the first connection is established while opening, and opening
 * fails if it cannot be made within {@link DatabaseConfig#connectionTimeout()}. Connections are
 * handed out in auto-commit mode.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ConnectionPoolFactory pools = new HikariConnectionPoolFactory(cfg -> cfg.setLeakDetectionThreshold(30_000));
 * AppContext context = AppContext.create(config, pools);
 * }</pre>
 */
public final class HikariConnectionPoolFactory implements ConnectionPoolFactory {
  private static final Logger logger = Logger.getLogger(HikariConnectionPoolFactory.class.getName());

  private final Consumer<HikariConfig> customizer;

  public HikariConnectionPoolFactory() {
    this(cfg -> { });
  }

  /**
   * @param customizer applied to every pool configuration after the standard settings
   */
  public HikariConnectionPoolFactory(Consumer<HikariConfig> customizer) {
    this.customizer = Objects.requireNonNull(customizer, "customizer");
  }

  @Override
  public ConnectionPool open(String poolName, Endpoint endpoint, DatabaseConfig config) {
    HikariConfig hikari = hikariConfig(poolName, endpoint, config);
    logger.log(Level.FINE, "Opening pool {0} (max {1})",
        new Object[]{poolName, config.maxPoolSize()});
    return new HikariConnectionPool(new HikariDataSource(hikari));
  }

  HikariConfig hikariConfig(String poolName, Endpoint endpoint, DatabaseConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName(poolName);
    hikari.setJdbcUrl(endpoint.jdbcUrl());
    if (endpoint.username() != null) {
      hikari.setUsername(endpoint.username());
    }
    if (endpoint.password() != null) {
      hikari.setPassword(endpoint.password().value());
    }
    hikari.setMinimumIdle(config.minPoolSize());
    hikari.setMaximumPoolSize(config.maxPoolSize());
    long timeoutMs = config.connectionTimeout().toMillis();
    hikari.setConnectionTimeout(timeoutMs);
    hikari.setInitializationFailTimeout(timeoutMs);
    hikari.setAutoCommit(true);
    customizer.accept(hikari);
    return hikari;
  }
}
