package paystore.jdbc;

import paystore.db.Database;
import paystore.db.MissingReturnedRowException;
import paystore.db.QueryExecutor;
import paystore.db.Route;
import paystore.db.RowMapper;
import paystore.jdbc.dialect.Dialects;
import paystore.jdbc.spi.Dialect;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statement plumbing shared by the JDBC repositories. Each repository holds one instance bound to
 * the database it reads and writes.
 *
 * <p>Writes always go to master and return the written row through the dialect's returning
 * clause. Reads go to the route the caller names; the repository decides per operation whether it
 * can tolerate replica lag.
 */
public final class RepositorySupport {
  private final Database database;
  private final Dialect dialect;

  /**
   * Binds to {@code database}, detecting the dialect from its JDBC URLs.
   */
  public RepositorySupport(Database database) {
    this(database, Dialects.forDatabase(database));
  }

  public RepositorySupport(Database database, Dialect dialect) {
    this.database = Objects.requireNonNull(database, "database");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public Database database() {
    return database;
  }

  public Dialect dialect() {
    return dialect;
  }

  /**
   * Current time at the precision the databases store.
   */
  public static Instant now() {
    return Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Inserts one row on master and returns it as written, including database defaults.
   *
   * @throws MissingReturnedRowException if the statement returned no row
   */
  public <T> T insert(Table table, ColumnValues values, RowMapper<T> mapper) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Insert into " + table.name() + " without values");
    }
    List<String> placeholders = new ArrayList<>();
    for (String column : values.columns()) {
      placeholders.add(placeholder(values, column));
    }
    String dml = "INSERT INTO " + table.name() + " (" + String.join(", ", values.columns())
        + ") VALUES (" + String.join(", ", placeholders) + ")";
    return database.master()
        .fetchOne(dialect.returning(dml, table.columns()), mapper, values.values().toArray())
        .orElseThrow(() -> new MissingReturnedRowException(database.id().id(), table.name()));
  }

  /**
   * Updates the row whose {@code keyColumn} equals {@code key} on master and returns it as
   * written. An empty set-clause writes nothing and returns the current row from master.
   *
   * @return the row, or empty if no row matched
   */
  public <T> Optional<T> update(Table table, ColumnValues set, String keyColumn, Object key,
      RowMapper<T> mapper) {
    SqlIdentifiers.validate(keyColumn);
    if (set.isEmpty()) {
      return fetchOne(Route.MASTER, table.select() + " WHERE " + keyColumn + " = ?", mapper, key);
    }
    List<String> assignments = new ArrayList<>();
    for (String column : set.columns()) {
      assignments.add(column + " = " + placeholder(set, column));
    }
    String dml = "UPDATE " + table.name() + " SET " + String.join(", ", assignments)
        + " WHERE " + keyColumn + " = ?";
    List<Object> params = new ArrayList<>(set.values());
    params.add(key);
    return database.master().fetchOne(dialect.returning(dml, table.columns()), mapper,
        params.toArray());
  }

  public <T> Optional<T> fetchOne(Route route, String sql, RowMapper<T> mapper, Object... params) {
    return executor(route).fetchOne(sql, mapper, params);
  }

  public <T> List<T> fetchAll(Route route, String sql, RowMapper<T> mapper, Object... params) {
    return executor(route).fetchAll(sql, mapper, params);
  }

  /**
   * Reads the rows whose {@code keyColumn} is one of {@code keys}, ordered by {@code keyColumn}.
   * An empty key collection returns an empty list without a round trip.
   */
  public <T> List<T> fetchAllByKeys(Route route, Table table, String keyColumn,
      Collection<?> keys, RowMapper<T> mapper) {
    SqlIdentifiers.validate(keyColumn);
    if (keys.isEmpty()) {
      return List.of();
    }
    String sql = table.select() + " WHERE " + keyColumn + " IN ("
        + String.join(", ", Collections.nCopies(keys.size(), "?")) + ") ORDER BY " + keyColumn;
    return fetchAll(route, sql, mapper, keys.toArray());
  }

  private QueryExecutor executor(Route route) {
    return database.executor(route);
  }

  private String placeholder(ColumnValues values, String column) {
    return values.isJson(column) ? dialect.jsonPlaceholder() : "?";
  }
}
