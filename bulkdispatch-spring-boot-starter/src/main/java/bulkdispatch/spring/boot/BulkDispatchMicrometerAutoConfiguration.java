package bulkdispatch.spring.boot;

import bulkdispatch.micrometer.MicrometerMetricsExporter;
import bulkdispatch.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} is available and {@code bulkdispatch.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link BulkDispatchAutoConfiguration} so the exporter can be injected into the
 * job manager.
 */
@AutoConfiguration(before = BulkDispatchAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "bulkdispatch.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(BulkDispatchProperties.class)
public class BulkDispatchMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  @ConditionalOnBean(MeterRegistry.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, BulkDispatchProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
