package paystore.db;

/**
 * Which pool of a logical database a statement runs against.
 */
public enum Route {
  /** Read/write primary. Writes, and reads that must observe the caller's own writes. */
  MASTER,
  /** Read-only copy with no freshness guarantee relative to master writes. */
  REPLICA;

  /** Lowercase name used in pool names, logs and metric tags. */
  public String tag() {
    return name().toLowerCase();
  }
}
