package paystore.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the paystore application context.
 *
 * <pre>
 * paystore.databases.payin-paymentdb.master.url=jdbc:postgresql://payin-master/payin
 * paystore.databases.payin-paymentdb.replica.url=jdbc:postgresql://payin-replica/payin
 * paystore.available-maindb-replicas[0]=jdbc:postgresql://maindb-replica-1/main
 * paystore.stripe.accounts.us=sk_live_...
 * paystore.backoffice.base-url=https://backoffice.internal
 * </pre>
 *
 * @see PaystoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "paystore")
public class PaystoreProperties {

  /**
   * Endpoints per logical database, keyed by database name (e.g. {@code payin-paymentdb}).
   */
  private Map<String, Database> databases = new LinkedHashMap<>();

  /**
   * Candidate replicas one of which is shared by all maindb databases.
   */
  private List<String> availableMaindbReplicas = new ArrayList<>();

  /**
   * How the maindb replica is picked from the candidates.
   */
  private ReplicaSelection replicaSelection = ReplicaSelection.RANDOM;

  private final Pool pool = new Pool();
  private final Stripe stripe = new Stripe();
  private final Backoffice backoffice = new Backoffice();
  private final Metrics metrics = new Metrics();

  public Map<String, Database> getDatabases() {
    return databases;
  }

  public void setDatabases(Map<String, Database> databases) {
    this.databases = databases;
  }

  public List<String> getAvailableMaindbReplicas() {
    return availableMaindbReplicas;
  }

  public void setAvailableMaindbReplicas(List<String> availableMaindbReplicas) {
    this.availableMaindbReplicas = availableMaindbReplicas;
  }

  public ReplicaSelection getReplicaSelection() {
    return replicaSelection;
  }

  public void setReplicaSelection(ReplicaSelection replicaSelection) {
    this.replicaSelection = replicaSelection;
  }

  public Pool getPool() {
    return pool;
  }

  public Stripe getStripe() {
    return stripe;
  }

  public Backoffice getBackoffice() {
    return backoffice;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public enum ReplicaSelection {
    RANDOM,
    FIRST
  }

  public static class Database {
    private final Endpoint master = new Endpoint();
    private final Endpoint replica = new Endpoint();

    public Endpoint getMaster() {
      return master;
    }

    public Endpoint getReplica() {
      return replica;
    }
  }

  public static class Endpoint {
    private String url;
    private String username;
    private String password;

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }
  }

  public static class Pool {
    private int minSize = 1;
    private int maxSize = 5;
    private Duration connectionTimeout = Duration.ofSeconds(5);
    private Duration queryTimeout = Duration.ofSeconds(10);

    public int getMinSize() {
      return minSize;
    }

    public void setMinSize(int minSize) {
      this.minSize = minSize;
    }

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }

    public Duration getConnectionTimeout() {
      return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
    }

    public Duration getQueryTimeout() {
      return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
      this.queryTimeout = queryTimeout;
    }
  }

  public static class Stripe {
    /**
     * Secret key per two-letter country code.
     */
    private Map<String, String> accounts = new LinkedHashMap<>();
    private int maxWorkers = 10;

    public Map<String, String> getAccounts() {
      return accounts;
    }

    public void setAccounts(Map<String, String> accounts) {
      this.accounts = accounts;
    }

    public int getMaxWorkers() {
      return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
      this.maxWorkers = maxWorkers;
    }
  }

  public static class Backoffice {
    private String baseUrl;
    private String email;
    private String password;
    private Duration jwtTokenTtl = Duration.ofMinutes(30);

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getEmail() {
      return email;
    }

    public void setEmail(String email) {
      this.email = email;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public Duration getJwtTokenTtl() {
      return jwtTokenTtl;
    }

    public void setJwtTokenTtl(Duration jwtTokenTtl) {
      this.jwtTokenTtl = jwtTokenTtl;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "paystore";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
