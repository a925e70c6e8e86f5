package paystore.jdbc;

import paystore.db.Database;
import paystore.db.DatabaseId;
import paystore.db.MissingReturnedRowException;
import paystore.db.Route;
import paystore.db.RowMapper;
import paystore.jdbc.dialect.H2Dialect;
import paystore.jdbc.spi.Dialect;
import paystore.model.FieldUpdate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RepositorySupportTest {
  private static final Table PAYERS = Table.of("payers", "id", "country", "description");
  private static final RowMapper<String> DESCRIPTION = row -> row.string("description");

  private Database database;
  private RepositorySupport support;

  @BeforeEach
  void setUp() {
    database = H2Databases.connected(DatabaseId.PAYIN_PAYMENTDB);
    support = new RepositorySupport(database);
  }

  @AfterEach
  void tearDown() {
    database.disconnect();
  }

  private ColumnValues payer(String id, String description) {
    return ColumnValues.create()
        .put("id", id)
        .put("payer_type", "marketplace")
        .put("country", "US")
        .put("description", description)
        .put("created_at", RepositorySupport.now());
  }

  @Test
  void dialectIsDetectedFromMasterUrl() {
    assertEquals("h2", support.dialect().name());
    assertSame(database, support.database());
  }

  @Test
  void insert_returnsWrittenRow() {
    assertEquals("first", support.insert(PAYERS, payer("p-1", "first"), DESCRIPTION));
  }

  @Test
  void insert_withoutValues_isRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> support.insert(PAYERS, ColumnValues.create(), DESCRIPTION));
  }

  @Test
  void insert_noReturnedRow_throwsMissingReturnedRow() {
    Dialect h2 = new H2Dialect();
    RepositorySupport noRows = new RepositorySupport(database, new Dialect() {
      @Override
      public String name() {
        return "h2-empty";
      }

      @Override
      public List<String> jdbcUrlPrefixes() {
        return h2.jdbcUrlPrefixes();
      }

      @Override
      public String returning(String dml, List<String> columns) {
        return h2.returning(dml, columns) + " WHERE 1 = 0";
      }
    });

    MissingReturnedRowException ex = assertThrows(MissingReturnedRowException.class,
        () -> noRows.insert(PAYERS, payer("p-1", "first"), DESCRIPTION));

    assertTrue(ex.getMessage().contains("payers"));
  }

  @Test
  void update_emptySet_readsCurrentRow() {
    support.insert(PAYERS, payer("p-1", "first"), DESCRIPTION);

    assertEquals(Optional.of("first"),
        support.update(PAYERS, ColumnValues.create(), "id", "p-1", DESCRIPTION));
    assertEquals(Optional.empty(),
        support.update(PAYERS, ColumnValues.create(), "id", "p-2", DESCRIPTION));
  }

  @Test
  void update_appliesOnlyPresentFields() {
    support.insert(PAYERS, payer("p-1", "first"), DESCRIPTION);
    ColumnValues set = ColumnValues.create()
        .putIfPresent("description", FieldUpdate.absent())
        .putIfPresent("country", FieldUpdate.of("CA"));

    Optional<String> country = support.update(PAYERS, set, "id", "p-1", row -> row.string("country"));

    assertEquals(Optional.of("CA"), country);
    assertEquals(List.of("country"), set.columns());
  }

  @Test
  void update_rejectsUnsafeKeyColumn() {
    assertThrows(IllegalArgumentException.class, () -> support.update(PAYERS,
        ColumnValues.create().put("country", "CA"), "id = id OR 1", "p-1", DESCRIPTION));
  }

  @Test
  void fetchAllByKeys_emptyKeys_returnsEmptyList() {
    assertEquals(List.of(), support.fetchAllByKeys(Route.REPLICA, PAYERS, "id", List.of(), DESCRIPTION));
  }

  @Test
  void fetchAllByKeys_orderedByKey() {
    support.insert(PAYERS, payer("p-2", "second"), DESCRIPTION);
    support.insert(PAYERS, payer("p-1", "first"), DESCRIPTION);

    assertEquals(List.of("first", "second"),
        support.fetchAllByKeys(Route.REPLICA, PAYERS, "id", List.of("p-2", "p-1", "p-9"), DESCRIPTION));
  }

  @Test
  void now_hasMicrosecondPrecision() {
    Instant now = RepositorySupport.now();

    assertEquals(0, now.getNano() % 1_000);
  }

  @Test
  void table_rejectsInvalidIdentifiers() {
    assertThrows(IllegalArgumentException.class, () -> Table.of("payers; DROP TABLE x", "id"));
    assertThrows(IllegalArgumentException.class, () -> Table.of("payers", "id", "bad column"));
    assertThrows(IllegalArgumentException.class, () -> Table.of("payers"));
  }

  @Test
  void columnValues_tracksJsonColumns() {
    ColumnValues values = ColumnValues.create()
        .put("id", "p-1")
        .putJsonIfPresent("metadata", FieldUpdate.of(List.of("a")), list -> "[\"a\"]")
        .putJsonIfPresent("extra", FieldUpdate.<List<String>>of(null), list -> "unused");

    assertTrue(values.isJson("metadata"));
    assertTrue(values.isJson("extra"));
    assertFalse(values.isJson("id"));
    assertEquals(Arrays.asList("p-1", "[\"a\"]", null), values.values());
  }
}
