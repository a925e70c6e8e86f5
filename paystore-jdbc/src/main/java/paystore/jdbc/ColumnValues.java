package paystore.jdbc;

import paystore.model.FieldUpdate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Ordered column-to-value assignments for an insert or the set-clause of an update.
 *
 * <p>Columns holding JSON are tracked separately so that the dialect can cast their parameters.
 */
public final class ColumnValues {
  private final Map<String, Object> values = new LinkedHashMap<>();
  private final List<String> jsonColumns = new ArrayList<>();

  public static ColumnValues create() {
    return new ColumnValues();
  }

  /**
   * Assigns {@code value}; {@code null} writes SQL NULL.
   */
  public ColumnValues put(String column, Object value) {
    values.put(SqlIdentifiers.validate(column), value);
    return this;
  }

  /**
   * Assigns JSON text; {@code null} writes SQL NULL.
   */
  public ColumnValues putJson(String column, String json) {
    put(column, json);
    if (!jsonColumns.contains(column)) {
      jsonColumns.add(column);
    }
    return this;
  }

  /**
   * Assigns the value of a present update; absent updates are skipped.
   */
  public ColumnValues putIfPresent(String column, FieldUpdate<?> update) {
    if (update.isPresent()) {
      put(column, update.value());
    }
    return this;
  }

  /**
   * Assigns the encoded value of a present update; a present {@code null} stays SQL NULL.
   */
  public <T> ColumnValues putJsonIfPresent(String column, FieldUpdate<T> update,
      Function<T, String> encoder) {
    if (update.isPresent()) {
      T value = update.value();
      putJson(column, value == null ? null : encoder.apply(value));
    }
    return this;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public List<String> columns() {
    return List.copyOf(values.keySet());
  }

  /** Values in column order. */
  public List<Object> values() {
    return Collections.unmodifiableList(new ArrayList<>(values.values()));
  }

  public boolean isJson(String column) {
    return jsonColumns.contains(column);
  }
}
