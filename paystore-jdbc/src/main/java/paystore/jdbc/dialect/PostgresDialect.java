package paystore.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect. Metadata columns are {@code jsonb}.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String jsonPlaceholder() {
    return "CAST(? AS jsonb)";
  }
}
