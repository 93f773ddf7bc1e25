package io.sqsoffline.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.sqsoffline.micrometer.MicrometerMetricsExporter;
import io.sqsoffline.spi.MetricsExporter;

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
 * {@link MeterRegistry} bean exists and {@code sqs-offline.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SqsOfflineAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link io.sqsoffline.SqsOffline} composite.
 */
@AutoConfiguration(before = SqsOfflineAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "sqs-offline.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SqsOfflineProperties.class)
public class SqsOfflineMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, SqsOfflineProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
