package paystore.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>H2 has no {@code RETURNING}; the written rows are read through a {@code FINAL TABLE}
 * data change delta table instead.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String returning(String dml, List<String> columns) {
    return "SELECT " + String.join(", ", columns) + " FROM FINAL TABLE (" + dml + ")";
  }
}
