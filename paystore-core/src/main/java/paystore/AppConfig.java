package paystore;

import paystore.client.BackofficeClientSettings;
import paystore.client.StripeClientSettings;
import paystore.db.DatabaseConfig;
import paystore.db.DatabaseId;
import paystore.db.DatabaseUrls;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of an {@link AppContext}.
 *
 * <p>Every {@link DatabaseId} must have endpoints. Create instances via {@link #builder()}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * AppConfig config = AppConfig.builder()
 *     .database(DatabaseId.PAYIN_PAYMENTDB, DatabaseUrls.of(masterUrl, replicaUrl))
 *     // ... the other five databases
 *     .availableMaindbReplicas(List.of(replicaA, replicaB))
 *     .stripe(StripeClientSettings.of(secretKey, "US"))
 *     .stripeMaxWorkers(10)
 *     .backoffice(backofficeSettings)
 *     .build();
 * }</pre>
 */
public final class AppConfig {
  private final DatabaseConfig databaseConfig;
  private final Map<DatabaseId, DatabaseUrls> databases;
  private final List<String> availableMaindbReplicas;
  private final List<StripeClientSettings> stripeSettings;
  private final int stripeMaxWorkers;
  private final BackofficeClientSettings backoffice;

  private AppConfig(Builder builder) {
    this.databaseConfig = Objects.requireNonNull(builder.databaseConfig, "databaseConfig");
    for (DatabaseId id : DatabaseId.values()) {
      if (!builder.databases.containsKey(id)) {
        throw new IllegalArgumentException("No endpoints configured for " + id.id());
      }
    }
    if (builder.stripeMaxWorkers <= 0) {
      throw new IllegalArgumentException("stripeMaxWorkers must be > 0");
    }
    this.databases = Collections.unmodifiableMap(new EnumMap<>(builder.databases));
    this.availableMaindbReplicas = List.copyOf(builder.availableMaindbReplicas);
    this.stripeSettings = List.copyOf(builder.stripeSettings);
    this.stripeMaxWorkers = builder.stripeMaxWorkers;
    this.backoffice = Objects.requireNonNull(builder.backoffice, "backoffice");
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Pool settings applied to every database. */
  public DatabaseConfig databaseConfig() {
    return databaseConfig;
  }

  public DatabaseUrls database(DatabaseId id) {
    return databases.get(id);
  }

  public Map<DatabaseId, DatabaseUrls> databases() {
    return databases;
  }

  /** Candidate replica URLs shared by the {@code *_maindb} databases; may be empty. */
  public List<String> availableMaindbReplicas() {
    return availableMaindbReplicas;
  }

  public List<StripeClientSettings> stripeSettings() {
    return stripeSettings;
  }

  public int stripeMaxWorkers() {
    return stripeMaxWorkers;
  }

  public BackofficeClientSettings backoffice() {
    return backoffice;
  }

  /** Builder for {@link AppConfig}. */
  public static final class Builder {
    private DatabaseConfig databaseConfig = DatabaseConfig.defaults();
    private final Map<DatabaseId, DatabaseUrls> databases = new EnumMap<>(DatabaseId.class);
    private final List<String> availableMaindbReplicas = new ArrayList<>();
    private final List<StripeClientSettings> stripeSettings = new ArrayList<>();
    private int stripeMaxWorkers = 10;
    private BackofficeClientSettings backoffice;

    private Builder() {}

    /**
     * Sets pool settings for all databases.
     *
     * <p>Optional. Defaults to {@link DatabaseConfig#defaults()}.
     */
    public Builder databaseConfig(DatabaseConfig databaseConfig) {
      this.databaseConfig = databaseConfig;
      return this;
    }

    /**
     * Sets the endpoints of one database.
     *
     * <p><b>Required</b> for each {@link DatabaseId}.
     */
    public Builder database(DatabaseId id, DatabaseUrls urls) {
      databases.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(urls, "urls"));
      return this;
    }

    /**
     * Sets the candidate replicas one of which is picked for all {@code *_maindb} databases.
     *
     * <p>Optional. Defaults to none, in which case each maindb uses its configured replica.
     */
    public Builder availableMaindbReplicas(List<String> replicaUrls) {
      availableMaindbReplicas.clear();
      availableMaindbReplicas.addAll(replicaUrls);
      return this;
    }

    /**
     * Adds the Stripe account of one country.
     */
    public Builder stripe(StripeClientSettings settings) {
      stripeSettings.add(Objects.requireNonNull(settings, "settings"));
      return this;
    }

    /**
     * Sets the number of Stripe worker threads.
     *
     * <p>Optional. Defaults to {@code 10}.
     */
    public Builder stripeMaxWorkers(int stripeMaxWorkers) {
      this.stripeMaxWorkers = stripeMaxWorkers;
      return this;
    }

    /**
     * Sets the backoffice API settings.
     *
     * <p><b>Required.</b>
     */
    public Builder backoffice(BackofficeClientSettings backoffice) {
      this.backoffice = backoffice;
      return this;
    }

    public AppConfig build() {
      return new AppConfig(this);
    }
  }
}
