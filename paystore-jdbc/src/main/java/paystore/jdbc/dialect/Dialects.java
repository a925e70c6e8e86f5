package paystore.jdbc.dialect;

import paystore.db.Database;
import paystore.jdbc.spi.Dialect;

import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks the {@link Dialect} a repository renders its SQL in.
 *
 * <p>Dialects are loaded once via {@link ServiceLoader} from
 * {@code META-INF/services/paystore.jdbc.spi.Dialect} and matched by JDBC URL prefix.
 */
public final class Dialects {
  private static final Logger logger = Logger.getLogger(Dialects.class.getName());

  private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private Dialects() {
  }

  /**
   * Resolves the dialect of a database handle from its master URL.
   *
   * <p>Repository statements are rendered once and run on either route, so the replica a handle
   * reads from (the configured replica or the shared maindb replica) must resolve to the same
   * dialect as its master.
   *
   * @throws IllegalArgumentException if a URL matches no dialect
   * @throws IllegalStateException if master and replica resolve to different dialects
   */
  public static Dialect forDatabase(Database database) {
    Dialect dialect = detect(database.masterEndpoint().jdbcUrl());
    if (!database.sharesReplicaWithMaster()) {
      Dialect replicaDialect = detect(database.replicaEndpoint().jdbcUrl());
      if (replicaDialect != dialect) {
        throw new IllegalStateException(database.id().id() + " master speaks " + dialect.name()
            + " but its replica speaks " + replicaDialect.name());
      }
    }
    logger.log(Level.FINE, "Using {0} dialect for {1}",
        new Object[]{dialect.name(), database.id().id()});
    return dialect;
  }

  /**
   * Auto-detects dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or matches no dialect
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    List<String> prefixes = DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
    throw new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + prefixes);
  }
}
