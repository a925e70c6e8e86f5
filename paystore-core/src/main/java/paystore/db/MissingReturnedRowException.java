package paystore.db;

/**
 * A write that must return exactly one row through its returning clause returned none.
 *
 * <p>This is a programming-contract violation (wrong table, trigger swallowing the row, broken
 * dialect), not a runtime condition to retry.
 */
public final class MissingReturnedRowException extends IllegalStateException {
  public MissingReturnedRowException(String databaseId, String table) {
    super("Write to " + databaseId + "." + table + " returned no row");
  }
}
