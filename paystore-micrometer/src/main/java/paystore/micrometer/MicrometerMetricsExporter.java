package paystore.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import paystore.db.Route;
import paystore.spi.MetricsExporter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are tagged with {@code database}, the logical database id, and registered lazily the
 * first time a tag combination is seen.
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code paystore.db.query} with tags {@code database}, {@code route} ({@code master} or
 *       {@code replica}) and {@code outcome} ({@code success} or {@code failure})</li>
 * </ul>
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code paystore.db.connect.failure} for pools that failed to open</li>
 *   <li>{@code paystore.db.integrity.violation} for writes rejected by a constraint</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Meter> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "paystore"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "paystore");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "payout.paystore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void recordQuery(String databaseId, Route route, long durationNanos, boolean success) {
    if (closed) return;
    String outcome = success ? "success" : "failure";
    Timer timer = (Timer) meters.computeIfAbsent(
        "query|" + databaseId + "|" + route.tag() + "|" + outcome,
        key -> Timer.builder(namePrefix + ".db.query")
            .description("Statement round trips including connection acquisition")
            .tag("database", databaseId)
            .tag("route", route.tag())
            .tag("outcome", outcome)
            .register(registry));
    timer.record(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void incrementConnectFailure(String databaseId) {
    if (closed) return;
    counter("connect.failure", databaseId, "Connection pools that failed to open").increment();
  }

  @Override
  public void incrementIntegrityViolation(String databaseId) {
    if (closed) return;
    counter("integrity.violation", databaseId, "Writes rejected by a storage constraint")
        .increment();
  }

  private Counter counter(String suffix, String databaseId, String description) {
    return (Counter) meters.computeIfAbsent(suffix + "|" + databaseId,
        key -> Counter.builder(namePrefix + ".db." + suffix)
            .description(description)
            .tag("database", databaseId)
            .register(registry));
  }

  /**
   * Removes all meters registered by this exporter from the registry. Later calls record nothing.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters.values()) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    if (first != null) throw first;
  }
}
