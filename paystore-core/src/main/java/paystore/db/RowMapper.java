package paystore.db;

import java.sql.SQLException;

/**
 * Maps the current row of a result into a typed output model.
 *
 * @param <T> the model type
 */
@FunctionalInterface
public interface RowMapper<T> {
  T map(Row row) throws SQLException;
}
