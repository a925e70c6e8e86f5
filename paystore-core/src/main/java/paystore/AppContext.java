package paystore;

import paystore.client.BackofficeClient;
import paystore.client.StripeClientPool;
import paystore.db.Database;
import paystore.db.DatabaseId;
import paystore.db.ReplicaSelector;
import paystore.spi.ConnectionPoolFactory;
import paystore.spi.MetricsExporter;
import paystore.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide owner of the logical databases and the non-database clients.
 *
 * <p>{@link #create} builds a handle per {@link DatabaseId}, connects them one after another in
 * declaration order and only returns once all are connected. The first failure aborts startup:
 * handles connected so far are disconnected again and the failure propagates, so no partially
 * connected context is ever returned.
 *
 * <p>The {@code *_maindb} handles share one alternative replica, chosen once per context by the
 * {@link ReplicaSelector} from {@link AppConfig#availableMaindbReplicas()}.
 *
 * <p>{@link #close()} disconnects all handles concurrently and then always shuts down the Stripe
 * worker pool, even when a disconnect failed. The first disconnect failure is rethrown after that.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (AppContext context = AppContext.create(config, new HikariConnectionPoolFactory())) {
 *   PayerRepository payers = new JdbcPayerRepository(context.payinPaymentDb());
 *   // ...
 * }
 * }</pre>
 */
public final class AppContext implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AppContext.class.getName());

  private final Map<DatabaseId, Database> databases;
  private final Optional<String> selectedMaindbReplica;
  private final StripeClientPool stripe;
  private final BackofficeClient backofficeClient;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private AppContext(Map<DatabaseId, Database> databases, Optional<String> selectedMaindbReplica,
      StripeClientPool stripe, BackofficeClient backofficeClient, MetricsExporter metrics) {
    this.databases = databases;
    this.selectedMaindbReplica = selectedMaindbReplica;
    this.stripe = stripe;
    this.backofficeClient = backofficeClient;
    this.metrics = metrics;
  }

  /**
   * Creates a context with a uniformly random maindb replica and no metrics.
   */
  public static AppContext create(AppConfig config, ConnectionPoolFactory poolFactory) {
    return create(config, poolFactory, ReplicaSelector.random(), MetricsExporter.NOOP);
  }

  /**
   * Creates and connects a context.
   *
   * @throws paystore.db.DatabaseConnectionException if any database fails to connect
   */
  public static AppContext create(AppConfig config, ConnectionPoolFactory poolFactory,
      ReplicaSelector replicaSelector, MetricsExporter metrics) {
    return create(config, poolFactory, replicaSelector, metrics,
        c -> new StripeClientPool(c.stripeSettings(), c.stripeMaxWorkers()));
  }

  static AppContext create(AppConfig config, ConnectionPoolFactory poolFactory,
      ReplicaSelector replicaSelector, MetricsExporter metrics,
      Function<AppConfig, StripeClientPool> stripeFactory) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(poolFactory, "poolFactory");
    Objects.requireNonNull(replicaSelector, "replicaSelector");
    MetricsExporter exporter = metrics == null ? MetricsExporter.NOOP : metrics;

    Optional<String> selected = replicaSelector.select(config.availableMaindbReplicas());
    selected.ifPresent(url -> logger.log(Level.INFO, "Using maindb replica {0}", url));

    Map<DatabaseId, Database> handles = new EnumMap<>(DatabaseId.class);
    for (DatabaseId id : DatabaseId.values()) {
      Database handle = id.usesMaindbReplica()
          ? Database.createWithAlternativeReplica(id, config.databaseConfig(), config.database(id),
              selected, poolFactory, exporter)
          : Database.create(id, config.databaseConfig(), config.database(id), poolFactory, exporter);
      handles.put(id, handle);
    }

    List<Database> connected = new ArrayList<>();
    for (Database handle : handles.values()) {
      logger.log(Level.FINE, "Connecting {0}", handle.id().id());
      try {
        handle.connect();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to connect to " + handle.id().id(), e);
        disconnectAfterFailedStart(connected, e);
        throw e;
      }
      connected.add(handle);
    }

    StripeClientPool stripe = null;
    BackofficeClient backoffice;
    try {
      stripe = stripeFactory.apply(config);
      backoffice = new BackofficeClient(config.backoffice());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to create app context clients", e);
      if (stripe != null) {
        stripe.shutdown(false);
      }
      disconnectAfterFailedStart(connected, e);
      throw e;
    }
    logger.log(Level.FINE, "App context created");
    return new AppContext(Collections.unmodifiableMap(handles), selected, stripe, backoffice,
        exporter);
  }

  public Database payoutMainDb() {
    return databases.get(DatabaseId.PAYOUT_MAINDB);
  }

  public Database payoutBankDb() {
    return databases.get(DatabaseId.PAYOUT_BANKDB);
  }

  public Database payinMainDb() {
    return databases.get(DatabaseId.PAYIN_MAINDB);
  }

  public Database payinPaymentDb() {
    return databases.get(DatabaseId.PAYIN_PAYMENTDB);
  }

  public Database ledgerMainDb() {
    return databases.get(DatabaseId.LEDGER_MAINDB);
  }

  public Database ledgerPaymentDb() {
    return databases.get(DatabaseId.LEDGER_PAYMENTDB);
  }

  public Database database(DatabaseId id) {
    return databases.get(id);
  }

  /** All handles in startup order. */
  public Map<DatabaseId, Database> databases() {
    return databases;
  }

  /** The replica URL shared by the maindb handles, if one was selected. */
  public Optional<String> selectedMaindbReplica() {
    return selectedMaindbReplica;
  }

  public StripeClientPool stripe() {
    return stripe;
  }

  public BackofficeClient backofficeClient() {
    return backofficeClient;
  }

  /**
   * Disconnects every database concurrently, then shuts down the Stripe pool without waiting for
   * running calls and closes the metrics exporter if it is closeable. Only the first call has an
   * effect.
   *
   * @throws RuntimeException the first disconnect failure, with later failures suppressed
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      first = disconnectAll();
    } finally {
      stripe.shutdown(false);
      if (metrics instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception e) {
          RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
          if (first == null) first = re; else first.addSuppressed(re);
        }
      }
    }
    if (first != null) {
      throw first;
    }
    logger.log(Level.FINE, "App context closed");
  }

  private RuntimeException disconnectAll() {
    ExecutorService executor = Executors.newFixedThreadPool(databases.size(),
        new DaemonThreadFactory("paystore-disconnect-"));
    try {
      List<CompletableFuture<Void>> futures = new ArrayList<>();
      for (Database handle : databases.values()) {
        futures.add(CompletableFuture.runAsync(handle::disconnect, executor));
      }
      RuntimeException first = null;
      for (CompletableFuture<Void> future : futures) {
        try {
          future.join();
        } catch (CompletionException e) {
          RuntimeException cause = (e.getCause() instanceof RuntimeException r) ? r : e;
          logger.log(Level.WARNING, "Database disconnect failed", cause);
          if (first == null) first = cause; else first.addSuppressed(cause);
        }
      }
      return first;
    } finally {
      executor.shutdown();
    }
  }

  private static void disconnectAfterFailedStart(List<Database> connected, RuntimeException failure) {
    for (Database handle : connected) {
      try {
        handle.disconnect();
      } catch (RuntimeException e) {
        failure.addSuppressed(e);
      }
    }
  }
}
