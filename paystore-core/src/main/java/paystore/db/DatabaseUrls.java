package paystore.db;

import java.util.Objects;

/**
 * Configured endpoints of one logical database. A {@code null} replica means the database has no
 * independent replica and replica reads go to master.
 */
public record DatabaseUrls(Endpoint master, Endpoint replica) {

  public DatabaseUrls {
    Objects.requireNonNull(master, "master");
  }

  public static DatabaseUrls of(String masterUrl, String replicaUrl) {
    return new DatabaseUrls(Endpoint.of(masterUrl), replicaUrl == null ? null : Endpoint.of(replicaUrl));
  }

  public static DatabaseUrls masterOnly(String masterUrl) {
    return new DatabaseUrls(Endpoint.of(masterUrl), null);
  }
}
