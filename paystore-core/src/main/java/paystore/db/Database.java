package paystore.db;

import paystore.spi.ConnectionPool;
import paystore.spi.ConnectionPoolFactory;
import paystore.spi.MetricsExporter;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handle on one logical database: a master pool and a replica pool with a connect/disconnect
 * lifecycle.
 *
 * <p>The handle is either fully connected or disconnected as far as callers can tell:
 * {@link #connect()} opens both pools or none, and the accessors refuse to hand out executors
 * unless both pools are open.
 *
 * <p>When no replica endpoint is configured, or it points at the master URL, the handle opens a
 * single pool and {@link #replica()} returns an executor on the master pool. This is deliberate
 * for low-volume databases that have no replica.
 *
 * @see paystore.AppContext
 */
public final class Database {
  private static final Logger logger = Logger.getLogger(Database.class.getName());

  private final DatabaseId id;
  private final DatabaseConfig config;
  private final Endpoint master;
  private final Endpoint replica;
  private final ConnectionPoolFactory poolFactory;
  private final MetricsExporter metrics;

  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private ConnectionPool masterPool;
  private ConnectionPool replicaPool;
  private volatile QueryExecutor masterExecutor;
  private volatile QueryExecutor replicaExecutor;

  private Database(DatabaseId id, DatabaseConfig config, Endpoint master, Endpoint replica,
      ConnectionPoolFactory poolFactory, MetricsExporter metrics) {
    this.id = Objects.requireNonNull(id, "id");
    this.config = Objects.requireNonNull(config, "config");
    this.master = Objects.requireNonNull(master, "master");
    this.replica = replica;
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /**
   * Creates a disconnected handle using the configured endpoints.
   */
  public static Database create(DatabaseId id, DatabaseConfig config, DatabaseUrls urls,
      ConnectionPoolFactory poolFactory, MetricsExporter metrics) {
    Objects.requireNonNull(urls, "urls");
    return new Database(id, config, urls.master(), urls.replica(), poolFactory, metrics);
  }

  /**
   * Creates a disconnected handle whose replica is replaced by {@code alternativeReplicaUrl} when
   * present. The alternative keeps the configured replica credentials (or master credentials if no
   * replica is configured).
   */
  public static Database createWithAlternativeReplica(DatabaseId id, DatabaseConfig config,
      DatabaseUrls urls, Optional<String> alternativeReplicaUrl,
      ConnectionPoolFactory poolFactory, MetricsExporter metrics) {
    Objects.requireNonNull(urls, "urls");
    Endpoint replica = urls.replica();
    if (alternativeReplicaUrl.isPresent()) {
      Endpoint base = replica != null ? replica : urls.master();
      replica = base.withUrl(alternativeReplicaUrl.get());
    }
    return new Database(id, config, urls.master(), replica, poolFactory, metrics);
  }

  public DatabaseId id() {
    return id;
  }

  public DatabaseConfig config() {
    return config;
  }

  public Endpoint masterEndpoint() {
    return master;
  }

  /**
   * Endpoint replica reads go to; the master endpoint when the replica is shared with master.
   */
  public Endpoint replicaEndpoint() {
    return sharesReplicaWithMaster() ? master : replica;
  }

  /**
   * Whether replica reads are served by the master pool.
   */
  public boolean sharesReplicaWithMaster() {
    return replica == null || replica.jdbcUrl().equals(master.jdbcUrl());
  }

  public ConnectionState state() {
    return state;
  }

  /**
   * Opens the master pool, then the replica pool. No-op when already connected.
   *
   * @throws DatabaseConnectionException if either pool cannot be opened; any pool opened by this
   *     call has been closed again and the handle is disconnected
   */
  public synchronized void connect() {
    if (state == ConnectionState.CONNECTED) {
      return;
    }
    state = ConnectionState.CONNECTING;
    ConnectionPool openedMaster = null;
    try {
      openedMaster = poolFactory.open(poolName(Route.MASTER), master, config);
      ConnectionPool openedReplica = openedMaster;
      if (sharesReplicaWithMaster()) {
        logger.log(Level.INFO, "{0}: no independent replica configured, replica reads use master",
            id.id());
      } else {
        openedReplica = poolFactory.open(poolName(Route.REPLICA), replica, config);
      }
      masterPool = openedMaster;
      replicaPool = openedReplica;
      int timeout = config.queryTimeoutSeconds();
      masterExecutor = new QueryExecutor(id.id(), Route.MASTER, openedMaster, timeout, metrics);
      replicaExecutor = new QueryExecutor(id.id(), Route.REPLICA, openedReplica, timeout, metrics);
      state = ConnectionState.CONNECTED;
      logger.log(Level.FINE, "{0} connected", id.id());
    } catch (RuntimeException e) {
      state = ConnectionState.DISCONNECTED;
      metrics.incrementConnectFailure(id.id());
      DatabaseConnectionException failure = new DatabaseConnectionException(id.id(),
          "Failed to connect to " + id.id(), e);
      if (openedMaster != null) {
        closeQuietlyInto(openedMaster, failure);
      }
      throw failure;
    }
  }

  /**
   * Closes the replica pool, then the master pool. No-op when not connected. Both pools are
   * closed even if the first close fails, and the handle ends up disconnected either way.
   *
   * @throws DatabaseConnectionException if a pool failed to close
   */
  public synchronized void disconnect() {
    if (state != ConnectionState.CONNECTED) {
      return;
    }
    ConnectionPool closingReplica = replicaPool;
    ConnectionPool closingMaster = masterPool;
    masterExecutor = null;
    replicaExecutor = null;
    masterPool = null;
    replicaPool = null;
    state = ConnectionState.DISCONNECTED;

    RuntimeException first = null;
    if (closingReplica != closingMaster) {
      first = closePool(closingReplica, null);
    }
    first = closePool(closingMaster, first);
    if (first != null) {
      throw new DatabaseConnectionException(id.id(), "Failed to disconnect from " + id.id(), first);
    }
    logger.log(Level.FINE, "{0} disconnected", id.id());
  }

  /**
   * Executor bound to the master pool.
   *
   * @throws IllegalStateException if the handle is not connected
   */
  public QueryExecutor master() {
    QueryExecutor executor = masterExecutor;
    if (executor == null) {
      throw notConnected();
    }
    return executor;
  }

  /**
   * Executor bound to the replica pool, or to the master pool when the replica is shared.
   *
   * @throws IllegalStateException if the handle is not connected
   */
  public QueryExecutor replica() {
    QueryExecutor executor = replicaExecutor;
    if (executor == null) {
      throw notConnected();
    }
    return executor;
  }

  /**
   * Executor for the given route.
   */
  public QueryExecutor executor(Route route) {
    return route == Route.MASTER ? master() : replica();
  }

  @Override
  public String toString() {
    return "Database[" + id.id() + ", state=" + state + ", master=" + master.jdbcUrl()
        + ", replica=" + replicaEndpoint().jdbcUrl() + "]";
  }

  private String poolName(Route route) {
    return id.id() + "-" + route.tag();
  }

  private IllegalStateException notConnected() {
    return new IllegalStateException(id.id() + " is not connected (state=" + state + ")");
  }

  private static RuntimeException closePool(ConnectionPool pool, RuntimeException first) {
    try {
      pool.close();
      return first;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close pool " + pool.name(), e);
      if (first == null) {
        return e;
      }
      first.addSuppressed(e);
      return first;
    }
  }

  private static void closeQuietlyInto(ConnectionPool pool, RuntimeException failure) {
    try {
      pool.close();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
  }
}
