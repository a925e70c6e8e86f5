package paystore.spring.boot;

import paystore.AppConfig;
import paystore.AppContext;
import paystore.Secret;
import paystore.client.BackofficeClientSettings;
import paystore.client.StripeClientSettings;
import paystore.db.DatabaseConfig;
import paystore.db.DatabaseId;
import paystore.db.DatabaseUrls;
import paystore.db.Endpoint;
import paystore.db.ReplicaSelector;
import paystore.jdbc.HikariConnectionPoolFactory;
import paystore.jdbc.payin.JdbcPayerRepository;
import paystore.jdbc.payin.JdbcPaymentMethodRepository;
import paystore.jdbc.payin.JdbcPgpCustomerRepository;
import paystore.jdbc.payin.JdbcStripeCustomerRepository;
import paystore.jdbc.payout.JdbcTransferRepository;
import paystore.payin.PayerRepository;
import paystore.payin.PaymentMethodRepository;
import paystore.payin.PgpCustomerRepository;
import paystore.payin.StripeCustomerRepository;
import paystore.payout.TransferRepository;
import paystore.spi.ConnectionPoolFactory;
import paystore.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.Map;

/**
 * Auto-configuration for the paystore application context.
 *
 * <p>Builds an {@link AppConfig} from {@link PaystoreProperties}, connects an {@link AppContext}
 * at startup and closes it with the application context. The JDBC repositories are registered
 * against the database each of them belongs to.
 *
 * @see PaystoreProperties
 * @see PaystoreMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(AppContext.class)
@EnableConfigurationProperties(PaystoreProperties.class)
public class PaystoreAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ConnectionPoolFactory connectionPoolFactory() {
    return new HikariConnectionPoolFactory();
  }

  @Bean
  @ConditionalOnMissingBean
  public ReplicaSelector replicaSelector(PaystoreProperties props) {
    return switch (props.getReplicaSelection()) {
      case RANDOM -> ReplicaSelector.random();
      case FIRST -> ReplicaSelector.first();
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public AppConfig appConfig(PaystoreProperties props) {
    PaystoreProperties.Pool pool = props.getPool();
    AppConfig.Builder builder = AppConfig.builder()
        .databaseConfig(DatabaseConfig.builder()
            .minPoolSize(pool.getMinSize())
            .maxPoolSize(pool.getMaxSize())
            .connectionTimeout(pool.getConnectionTimeout())
            .queryTimeout(pool.getQueryTimeout())
            .build())
        .availableMaindbReplicas(props.getAvailableMaindbReplicas())
        .stripeMaxWorkers(props.getStripe().getMaxWorkers());

    for (Map.Entry<String, PaystoreProperties.Database> entry : props.getDatabases().entrySet()) {
      builder.database(DatabaseId.fromName(entry.getKey()), urls(entry.getKey(), entry.getValue()));
    }
    props.getStripe().getAccounts().forEach((country, secretKey) ->
        builder.stripe(StripeClientSettings.of(secretKey, country)));

    PaystoreProperties.Backoffice backoffice = props.getBackoffice();
    builder.backoffice(new BackofficeClientSettings(
        required(backoffice.getBaseUrl(), "paystore.backoffice.base-url"),
        required(backoffice.getEmail(), "paystore.backoffice.email"),
        Secret.of(required(backoffice.getPassword(), "paystore.backoffice.password")),
        backoffice.getJwtTokenTtl()));
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public AppContext appContext(AppConfig appConfig, ConnectionPoolFactory connectionPoolFactory,
      ReplicaSelector replicaSelector, ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    return AppContext.create(appConfig, connectionPoolFactory, replicaSelector, metrics);
  }

  @Bean
  @ConditionalOnMissingBean
  public PayerRepository payerRepository(AppContext appContext) {
    return new JdbcPayerRepository(appContext.payinPaymentDb());
  }

  @Bean
  @ConditionalOnMissingBean
  public PgpCustomerRepository pgpCustomerRepository(AppContext appContext) {
    return new JdbcPgpCustomerRepository(appContext.payinPaymentDb());
  }

  @Bean
  @ConditionalOnMissingBean
  public StripeCustomerRepository stripeCustomerRepository(AppContext appContext) {
    return new JdbcStripeCustomerRepository(appContext.payinMainDb());
  }

  @Bean
  @ConditionalOnMissingBean
  public PaymentMethodRepository paymentMethodRepository(AppContext appContext) {
    return new JdbcPaymentMethodRepository(appContext.payinPaymentDb());
  }

  @Bean
  @ConditionalOnMissingBean
  public TransferRepository transferRepository(AppContext appContext) {
    return new JdbcTransferRepository(appContext.payoutMainDb());
  }

  private static DatabaseUrls urls(String name, PaystoreProperties.Database database) {
    PaystoreProperties.Endpoint master = database.getMaster();
    required(master.getUrl(), "paystore.databases." + name + ".master.url");
    PaystoreProperties.Endpoint replica = database.getReplica();
    return new DatabaseUrls(endpoint(master),
        replica.getUrl() == null ? null : endpoint(replica));
  }

  private static Endpoint endpoint(PaystoreProperties.Endpoint props) {
    return new Endpoint(props.getUrl(), props.getUsername(),
        Secret.ofNullable(props.getPassword()));
  }

  private static String required(String value, String property) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(property + " must be set");
    }
    return value;
  }
}
