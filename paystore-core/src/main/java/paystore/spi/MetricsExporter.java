package paystore.spi;

import paystore.db.Route;

/**
 * Observability hook for database access metrics.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records one statement round trip.
   *
   * @param databaseId    logical database id, e.g. {@code payin_paymentdb}
   * @param route         pool the statement ran against
   * @param durationNanos wall time including connection acquisition
   * @param success       whether the statement completed without an exception
   */
  void recordQuery(String databaseId, Route route, long durationNanos, boolean success);

  /**
   * Increments the count of failed pool connects for a logical database.
   */
  void incrementConnectFailure(String databaseId);

  /**
   * Increments the count of writes rejected by a storage constraint.
   */
  default void incrementIntegrityViolation(String databaseId) {
  }

  /**
   * Default no-op implementation.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void recordQuery(String databaseId, Route route, long durationNanos, boolean success) {
    }

    @Override
    public void incrementConnectFailure(String databaseId) {
    }
  }
}
