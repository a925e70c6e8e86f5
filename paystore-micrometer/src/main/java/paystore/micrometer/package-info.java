/**
 * Micrometer bridge for exporting database access metrics to Prometheus, Datadog, and other
 * backends.
 *
 * <p>{@link paystore.micrometer.MicrometerMetricsExporter} implements the
 * {@link paystore.spi.MetricsExporter} SPI using Micrometer timers and counters.
 *
 * @see paystore.micrometer.MicrometerMetricsExporter
 */
package paystore.micrometer;
