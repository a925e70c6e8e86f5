package paystore.jdbc.payin;

import paystore.db.Database;
import paystore.db.DatabaseId;
import paystore.jdbc.H2Databases;
import paystore.payin.model.Payer;
import paystore.payin.model.PayerCreate;
import paystore.payin.model.PayerLookup;
import paystore.payin.model.PayerUpdate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a replica that never receives the master's writes, which makes the route of each
 * operation observable.
 */
class PayerRoutingTest {
  private Database database;
  private JdbcPayerRepository repository;

  @BeforeEach
  void setUp() {
    database = H2Databases.connectedWithSeparateReplica(DatabaseId.PAYIN_PAYMENTDB);
    repository = new JdbcPayerRepository(database);
  }

  @AfterEach
  void tearDown() {
    database.disconnect();
  }

  @Test
  void writesAndGetsUseMaster_listsUseReplica() {
    Payer inserted = repository.insertPayer(PayerCreate.builder()
        .id("p-1").payerType("marketplace").country("US").build());

    assertEquals(Optional.of(inserted), repository.getPayerById(PayerLookup.byId("p-1")));
    assertTrue(repository.updatePayerById("p-1", PayerUpdate.builder().description("x").build())
        .isPresent());
    assertEquals(List.of(), repository.listPayersByIds(List.of("p-1")));
  }

  @Test
  void listSeesRowsOnceReplicated() {
    H2Databases.execute(database.replicaEndpoint().jdbcUrl(),
        "INSERT INTO payers (id, payer_type, country, created_at) "
            + "VALUES ('p-2', 'marketplace', 'CA', TIMESTAMP WITH TIME ZONE '2024-01-01 00:00:00+00')");

    List<Payer> listed = repository.listPayersByIds(List.of("p-2"));

    assertEquals(1, listed.size());
    assertEquals("CA", listed.get(0).country());
    assertEquals(Optional.empty(), repository.getPayerById(PayerLookup.byId("p-2")));
  }
}
