/**
 * Service provider interfaces: connection pools and the metrics hook.
 *
 * <p>The JDBC module ships a HikariCP-backed {@link paystore.spi.ConnectionPoolFactory};
 * the Micrometer module ships a {@link paystore.spi.MetricsExporter}.
 */
package paystore.spi;
