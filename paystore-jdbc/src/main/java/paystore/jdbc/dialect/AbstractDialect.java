package paystore.jdbc.dialect;

import paystore.jdbc.spi.Dialect;

import java.util.List;

/**
 * Base dialect with the standard {@code RETURNING} clause.
 *
 * <p>Subclasses override methods where the database differs.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String returning(String dml, List<String> columns) {
    return dml + " RETURNING " + String.join(", ", columns);
  }
}
