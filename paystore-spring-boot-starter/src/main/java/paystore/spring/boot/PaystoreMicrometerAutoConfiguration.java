package paystore.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import paystore.micrometer.MicrometerMetricsExporter;
import paystore.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code paystore.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link PaystoreAutoConfiguration} so the {@link MetricsExporter} bean is
 * available when the app context is created. The app context closes the exporter on shutdown.
 */
@AutoConfiguration(before = PaystoreAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "paystore.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PaystoreProperties.class)
public class PaystoreMicrometerAutoConfiguration {

  @Bean(destroyMethod = "")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, PaystoreProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
