package paystore.db;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Named-column view over the current row of a {@link ResultSet}.
 *
 * <p>A column missing from the result reads as {@code null}, so models built from narrower
 * projections get absent optional fields. SQL NULL also reads as {@code null}; numeric accessors
 * therefore return boxed types. Conversion failures are not caught.
 */
public final class Row {
  private final ResultSet rs;
  private final Set<String> labels;

  Row(ResultSet rs) throws SQLException {
    this.rs = rs;
    ResultSetMetaData meta = rs.getMetaData();
    Set<String> names = new HashSet<>();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      names.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
    }
    this.labels = names;
  }

  public boolean has(String column) {
    return labels.contains(column.toLowerCase(Locale.ROOT));
  }

  public String string(String column) throws SQLException {
    return has(column) ? rs.getString(column) : null;
  }

  public Long longValue(String column) throws SQLException {
    if (!has(column)) {
      return null;
    }
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  public Integer intValue(String column) throws SQLException {
    if (!has(column)) {
      return null;
    }
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  public Boolean bool(String column) throws SQLException {
    if (!has(column)) {
      return null;
    }
    boolean value = rs.getBoolean(column);
    return rs.wasNull() ? null : value;
  }

  public Instant instant(String column) throws SQLException {
    if (!has(column)) {
      return null;
    }
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  /**
   * Like {@link #longValue} but the column must be present and non-null.
   *
   * @throws SQLException if the value is missing
   */
  public long requiredLong(String column) throws SQLException {
    Long value = longValue(column);
    if (value == null) {
      throw new SQLException("Column " + column + " is missing or NULL");
    }
    return value;
  }

  /**
   * Like {@link #string} but the column must be present and non-null.
   *
   * @throws SQLException if the value is missing
   */
  public String requiredString(String column) throws SQLException {
    String value = string(column);
    if (value == null) {
      throw new SQLException("Column " + column + " is missing or NULL");
    }
    return value;
  }
}
