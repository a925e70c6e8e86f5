package paystore.db;

import paystore.spi.ConnectionPool;
import paystore.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes statements against one pool of a logical database.
 *
 * <p>Obtained from {@link Database#master()} or {@link Database#replica()}. Every call borrows a
 * connection in auto-commit mode, applies the configured query timeout and returns the connection
 * before returning. Failures are logged with database, route and operation, then rethrown as
 * {@link DatabaseException} subclasses. Nothing is retried.
 */
public final class QueryExecutor {
  private static final Logger logger = Logger.getLogger(QueryExecutor.class.getName());

  private final String databaseId;
  private final Route route;
  private final ConnectionPool pool;
  private final int queryTimeoutSeconds;
  private final MetricsExporter metrics;

  QueryExecutor(String databaseId, Route route, ConnectionPool pool, int queryTimeoutSeconds,
      MetricsExporter metrics) {
    this.databaseId = databaseId;
    this.route = route;
    this.pool = pool;
    this.queryTimeoutSeconds = queryTimeoutSeconds;
    this.metrics = metrics;
  }

  public String databaseId() {
    return databaseId;
  }

  /**
   * The route this executor was requested for. A replica executor of a database without an
   * independent replica still reports {@link Route#REPLICA} even though it shares the master pool.
   */
  public Route route() {
    return route;
  }

  /**
   * Runs a query or a write with a returning clause and maps the first row, if any.
   */
  public <T> Optional<T> fetchOne(String sql, RowMapper<T> mapper, Object... params) {
    return run("fetchOne", conn -> {
      try (PreparedStatement ps = prepare(conn, sql, params);
          ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(mapper.map(new Row(rs)));
      }
    });
  }

  /**
   * Runs a query and maps every row, in result order.
   */
  public <T> List<T> fetchAll(String sql, RowMapper<T> mapper, Object... params) {
    return run("fetchAll", conn -> {
      try (PreparedStatement ps = prepare(conn, sql, params);
          ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        Row row = null;
        while (rs.next()) {
          if (row == null) {
            row = new Row(rs);
          }
          results.add(mapper.map(row));
        }
        return results;
      }
    });
  }

  /**
   * Runs a write without a returning clause.
   *
   * @return rows affected
   */
  public int execute(String sql, Object... params) {
    return run("execute", conn -> {
      try (PreparedStatement ps = prepare(conn, sql, params)) {
        return ps.executeUpdate();
      }
    });
  }

  private <R> R run(String operation, SqlWork<R> work) {
    long start = System.nanoTime();
    boolean success = false;
    try (Connection conn = pool.getConnection()) {
      R result = work.apply(conn);
      success = true;
      return result;
    } catch (SQLException e) {
      DatabaseException translated = SqlErrors.translate(databaseId, operation, e);
      if (translated instanceof IntegrityViolationException) {
        metrics.incrementIntegrityViolation(databaseId);
        logger.log(Level.FINE, "Constraint violation on {0} ({1}) during {2}: {3}",
            new Object[]{databaseId, route.tag(), operation, e.getMessage()});
      } else {
        logger.log(Level.WARNING, "Statement failed on " + databaseId + " (" + route.tag()
            + ") during " + operation, e);
      }
      throw translated;
    } finally {
      metrics.recordQuery(databaseId, route, System.nanoTime() - start, success);
    }
  }

  private PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      ps.setQueryTimeout(queryTimeoutSeconds);
      bindParams(ps, params);
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  @FunctionalInterface
  private interface SqlWork<R> {
    R apply(Connection conn) throws SQLException;
  }
}
