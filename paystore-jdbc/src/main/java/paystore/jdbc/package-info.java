/**
 * JDBC implementation: HikariCP pools, SQL dialects and the shared repository plumbing.
 *
 * <p>Typed repositories live in {@code paystore.jdbc.payin} and {@code paystore.jdbc.payout}.
 */
package paystore.jdbc;
