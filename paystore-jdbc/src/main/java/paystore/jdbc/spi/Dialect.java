package paystore.jdbc.spi;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations render the database-specific parts of repository SQL. Register custom
 * dialects via {@code META-INF/services/paystore.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, H2.
 *
 * @see paystore.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:postgresql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Wraps an {@code INSERT} or {@code UPDATE} so that executing it as a query yields the written
   * rows with {@code columns}, in a single round trip.
   *
   * @param dml     the data change statement, without trailing semicolon
   * @param columns the columns to return
   * @return a statement to run with {@code executeQuery}
   */
  String returning(String dml, List<String> columns);

  /**
   * Parameter placeholder for a JSON column.
   */
  default String jsonPlaceholder() {
    return "?";
  }
}
