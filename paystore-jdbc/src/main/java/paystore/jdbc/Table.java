package paystore.jdbc;

import java.util.List;

/**
 * A table and the columns its rows are read with, in select order.
 */
public record Table(String name, List<String> columns) {

  public Table {
    SqlIdentifiers.validate(name);
    columns = List.copyOf(columns);
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("Table " + name + " needs at least one column");
    }
    columns.forEach(SqlIdentifiers::validate);
  }

  public static Table of(String name, String... columns) {
    return new Table(name, List.of(columns));
  }

  /** Comma-separated column list. */
  public String columnList() {
    return String.join(", ", columns);
  }

  /** {@code SELECT <columns> FROM <name>} */
  public String select() {
    return "SELECT " + columnList() + " FROM " + name;
  }
}
