package paystore;

import paystore.client.BackofficeClientSettings;
import paystore.client.StripeClientPool;
import paystore.client.StripeClientSettings;
import paystore.db.ConnectionState;
import paystore.db.Database;
import paystore.db.DatabaseConnectionException;
import paystore.db.DatabaseId;
import paystore.db.DatabaseUrls;
import paystore.db.ReplicaSelector;
import paystore.db.Route;
import paystore.db.StubConnectionPoolFactory;
import paystore.spi.MetricsExporter;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AppContextTest {

  private static final List<String> MAINDB_REPLICAS =
      List.of("jdbc:stub:maindb-replica-a", "jdbc:stub:maindb-replica-b", "jdbc:stub:maindb-replica-c");

  private final StubConnectionPoolFactory pools = new StubConnectionPoolFactory();

  private static AppConfig.Builder config(List<String> maindbReplicas) {
    AppConfig.Builder builder = AppConfig.builder()
        .availableMaindbReplicas(maindbReplicas)
        .stripe(StripeClientSettings.of("sk_test", "US"))
        .stripeMaxWorkers(2)
        .backoffice(new BackofficeClientSettings("https://bo.example.com", "svc@example.com",
            Secret.of("pw"), Duration.ofMinutes(10)));
    for (DatabaseId id : DatabaseId.values()) {
      builder.database(id, DatabaseUrls.of(masterUrl(id), "jdbc:stub:" + id.id() + "-replica"));
    }
    return builder;
  }

  private static String masterUrl(DatabaseId id) {
    return "jdbc:stub:" + id.id() + "-master";
  }

  // ── startup ──────────────────────────────────────────────────────

  @Test
  void create_connectsDatabasesSequentiallyInDeclaredOrder() {
    try (AppContext context = AppContext.create(config(List.of()).build(), pools)) {
      List<String> masterOpens = pools.events().stream()
          .filter(e -> e.endsWith("-master"))
          .toList();

      assertEquals(List.of("open payout_maindb-master", "open payout_bankdb-master",
          "open payin_maindb-master", "open payin_paymentdb-master", "open ledger_maindb-master",
          "open ledger_paymentdb-master"), masterOpens);
      for (Database db : context.databases().values()) {
        assertEquals(ConnectionState.CONNECTED, db.state());
      }
      assertEquals(12, pools.openPools());
    }
  }

  @Test
  void create_exposesEachDatabase() {
    try (AppContext context = AppContext.create(config(List.of()).build(), pools)) {
      assertEquals(DatabaseId.PAYOUT_MAINDB, context.payoutMainDb().id());
      assertEquals(DatabaseId.PAYOUT_BANKDB, context.payoutBankDb().id());
      assertEquals(DatabaseId.PAYIN_MAINDB, context.payinMainDb().id());
      assertEquals(DatabaseId.PAYIN_PAYMENTDB, context.payinPaymentDb().id());
      assertEquals(DatabaseId.LEDGER_MAINDB, context.ledgerMainDb().id());
      assertEquals(DatabaseId.LEDGER_PAYMENTDB, context.ledgerPaymentDb().id());
      assertSame(context.payinPaymentDb(), context.database(DatabaseId.PAYIN_PAYMENTDB));
      assertEquals("sk_test", context.stripe().settingsFor("US").apiKey().value());
      assertEquals("svc@example.com", context.backofficeClient().settings().email());
    }
  }

  @Test
  void create_maindbsShareOneSelectedReplica() {
    for (int run = 0; run < 50; run++) {
      StubConnectionPoolFactory runPools = new StubConnectionPoolFactory();
      try (AppContext context = AppContext.create(config(MAINDB_REPLICAS).build(), runPools)) {
        String selected = context.selectedMaindbReplica().orElseThrow();

        assertTrue(MAINDB_REPLICAS.contains(selected));
        assertEquals(selected, context.payoutMainDb().replicaEndpoint().jdbcUrl());
        assertEquals(selected, context.payinMainDb().replicaEndpoint().jdbcUrl());
        assertEquals(selected, context.ledgerMainDb().replicaEndpoint().jdbcUrl());
      }
    }
  }

  @Test
  void create_nonMaindbsKeepConfiguredReplica() {
    try (AppContext context = AppContext.create(config(MAINDB_REPLICAS).build(), pools)) {
      assertEquals("jdbc:stub:payout_bankdb-replica", context.payoutBankDb().replicaEndpoint().jdbcUrl());
      assertEquals("jdbc:stub:payin_paymentdb-replica",
          context.payinPaymentDb().replicaEndpoint().jdbcUrl());
      assertEquals("jdbc:stub:ledger_paymentdb-replica",
          context.ledgerPaymentDb().replicaEndpoint().jdbcUrl());
    }
  }

  @Test
  void create_noCandidates_maindbsKeepConfiguredReplica() {
    try (AppContext context = AppContext.create(config(List.of()).build(), pools)) {
      assertEquals(Optional.empty(), context.selectedMaindbReplica());
      assertEquals("jdbc:stub:payin_maindb-replica", context.payinMainDb().replicaEndpoint().jdbcUrl());
    }
  }

  @Test
  void create_callsSelectorExactlyOnce() {
    AtomicInteger calls = new AtomicInteger();
    ReplicaSelector counting = candidates -> {
      calls.incrementAndGet();
      return ReplicaSelector.first().select(candidates);
    };

    try (AppContext context = AppContext.create(config(MAINDB_REPLICAS).build(), pools, counting,
        MetricsExporter.NOOP)) {
      assertEquals(1, calls.get());
      assertEquals(Optional.of("jdbc:stub:maindb-replica-a"), context.selectedMaindbReplica());
    }
  }

  @Test
  void create_failure_stopsStartupAndReleasesConnectedDatabases() {
    pools.failOpen(masterUrl(DatabaseId.PAYIN_MAINDB));

    DatabaseConnectionException e = assertThrows(DatabaseConnectionException.class,
        () -> AppContext.create(config(List.of()).build(), pools));

    assertEquals("payin_maindb", e.databaseId());
    assertEquals(0, pools.openPools());
    assertTrue(pools.events().stream().noneMatch(ev -> ev.contains("payin_paymentdb")));
    assertTrue(pools.events().stream().noneMatch(ev -> ev.contains("ledger_")));
    assertTrue(pools.events().contains("close payout_maindb-master"));
    assertTrue(pools.events().contains("close payout_bankdb-replica"));
  }

  @Test
  void create_failureOfLastDatabase_releasesAllOthers() {
    pools.failOpen("jdbc:stub:ledger_paymentdb-replica");

    DatabaseConnectionException e = assertThrows(DatabaseConnectionException.class,
        () -> AppContext.create(config(List.of()).build(), pools));

    assertEquals("ledger_paymentdb", e.databaseId());
    assertEquals(0, pools.openPools());
  }

  @Test
  void create_clientFailure_shutsDownStripeAndReleasesDatabases() {
    AppConfig config = config(List.of())
        .backoffice(new BackofficeClientSettings("https://bo example.com", "svc@example.com",
            Secret.of("pw"), Duration.ofMinutes(10)))
        .build();
    AtomicReference<StripeClientPool> stripe = new AtomicReference<>();

    assertThrows(IllegalArgumentException.class,
        () -> AppContext.create(config, pools, ReplicaSelector.first(), MetricsExporter.NOOP, c -> {
          stripe.set(new StripeClientPool(c.stripeSettings(), c.stripeMaxWorkers()));
          return stripe.get();
        }));

    assertNotNull(stripe.get());
    assertTrue(stripe.get().isShutdown());
    assertEquals(0, pools.openPools());
  }

  @Test
  void config_missingDatabase_throws() {
    AppConfig.Builder builder = AppConfig.builder()
        .backoffice(new BackofficeClientSettings("https://bo.example.com", "svc@example.com",
            Secret.of("pw"), Duration.ofMinutes(10)))
        .database(DatabaseId.PAYIN_PAYMENTDB, DatabaseUrls.masterOnly("jdbc:stub:x"));

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  // ── shutdown ─────────────────────────────────────────────────────

  @Test
  void close_disconnectsEverythingAndShutsDownStripe() {
    AppContext context = AppContext.create(config(MAINDB_REPLICAS).build(), pools);

    context.close();

    assertEquals(0, pools.openPools());
    assertTrue(context.stripe().isShutdown());
    for (Database db : context.databases().values()) {
      assertEquals(ConnectionState.DISCONNECTED, db.state());
      assertThrows(IllegalStateException.class, () -> db.executor(Route.MASTER));
    }
  }

  @Test
  void close_disconnectFailure_stillShutsDownStripeAndRethrows() {
    pools.failClose("payin_paymentdb-replica").failClose("ledger_maindb-master");
    AppContext context = AppContext.create(config(List.of()).build(), pools);

    DatabaseConnectionException e = assertThrows(DatabaseConnectionException.class, context::close);

    assertTrue(context.stripe().isShutdown());
    assertEquals(0, pools.openPools());
    assertTrue(List.of("payin_paymentdb", "ledger_maindb").contains(e.databaseId()));
    assertEquals(1, e.getSuppressed().length);
  }

  @Test
  void close_twice_isNoOp() {
    AppContext context = AppContext.create(config(List.of()).build(), pools);
    context.close();
    int events = pools.events().size();

    assertDoesNotThrow(context::close);

    assertEquals(events, pools.events().size());
  }

  @Test
  void close_closesCloseableMetricsExporter() {
    AtomicBoolean closed = new AtomicBoolean();
    CloseableMetrics metrics = new CloseableMetrics(closed);
    AppContext context = AppContext.create(config(List.of()).build(), pools, ReplicaSelector.first(),
        metrics);

    context.close();

    assertTrue(closed.get());
  }

  private static final class CloseableMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    CloseableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void recordQuery(String databaseId, Route route, long durationNanos, boolean success) {
    }

    @Override
    public void incrementConnectFailure(String databaseId) {
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
