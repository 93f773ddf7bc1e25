package io.sqsoffline.spring.boot;

import io.sqsoffline.SqsOffline;
import io.sqsoffline.client.InMemoryQueueClient;
import io.sqsoffline.config.QueueDescriptor;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.invoke.ClassDirectoryHandlerLoader;
import io.sqsoffline.invoke.CompositeHandlerLoader;
import io.sqsoffline.invoke.DefaultHandlerRegistry;
import io.sqsoffline.invoke.HandlerLoader;
import io.sqsoffline.spi.MetricsExporter;
import io.sqsoffline.spi.QueueClient;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the local queue emulator.
 *
 * <p>Wires up a {@link SqsOffline} composite from {@link SqsOfflineProperties}, a
 * {@link QueueClient} (an {@link InMemoryQueueClient} unless the application defines one)
 * and every {@link HandlerLoader} bean, the {@link DefaultHandlerRegistry} filled from
 * {@link SqsHandler} beans included.
 *
 * @see SqsOfflineProperties
 * @see SqsOfflineMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(SqsOffline.class)
@ConditionalOnProperty(prefix = "sqs-offline", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SqsOfflineProperties.class)
public class SqsOfflineAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SqsOfflineConfig sqsOfflineConfig(SqsOfflineProperties props) {
    SqsOfflineConfig.Builder builder = SqsOfflineConfig.builder()
        .enabled(props.isEnabled())
        .region(props.getRegion())
        .accountId(props.getAccountId())
        .endpoint(props.getEndpoint())
        .accessKeyId(props.getAccessKeyId())
        .secretAccessKey(props.getSecretAccessKey())
        .autoCreate(props.isAutoCreate())
        .pollInterval(props.getPollInterval())
        .maxConcurrentPolls(props.getMaxConcurrentPolls())
        .visibilityTimeoutSeconds(props.getVisibilityTimeout())
        .waitTimeSeconds(props.getWaitTimeSeconds())
        .maxReceiveCount(props.getMaxReceiveCount())
        .deadLetterQueueSuffix(props.getDeadLetterQueueSuffix())
        .skipCacheInvalidation(props.isSkipCacheInvalidation())
        .handlerTimeout(props.getHandlerTimeout())
        .batchSize(props.getBatchSize())
        .drainTimeout(props.getDrainTimeout());
    for (SqsOfflineProperties.Queue queue : props.getQueues()) {
      builder.queue(queueDescriptor(queue));
    }
    return builder.build();
  }

  private static QueueDescriptor.Builder queueDescriptor(SqsOfflineProperties.Queue queue) {
    if (queue.getName() == null || queue.getHandler() == null) {
      throw new IllegalStateException("sqs-offline.queues entries require name and handler");
    }
    QueueDescriptor.Builder builder = QueueDescriptor.builder(queue.getName(), queue.getHandler())
        .enabled(queue.isEnabled())
        .deadLetterQueue(queue.isDeadLetterQueue());
    if (queue.getBatchSize() != null) {
      builder.batchSize(queue.getBatchSize());
    }
    if (queue.getConcurrencyLimit() != null) {
      builder.concurrencyLimit(queue.getConcurrencyLimit());
    }
    if (queue.getVisibilityTimeout() != null) {
      builder.visibilityTimeoutSeconds(queue.getVisibilityTimeout());
    }
    if (queue.getWaitTimeSeconds() != null) {
      builder.longPollWaitSeconds(queue.getWaitTimeSeconds());
    }
    if (queue.getHandlerTimeout() != null) {
      builder.handlerTimeout(queue.getHandlerTimeout());
    }
    if (queue.getMaxReceiveCount() != null) {
      builder.maxDeliveryAttempts(queue.getMaxReceiveCount());
    }
    if (queue.getDeadLetterQueueName() != null && !queue.getDeadLetterQueueName().isEmpty()) {
      builder.deadLetterQueueName(queue.getDeadLetterQueueName());
    }
    return builder;
  }

  @Bean
  @ConditionalOnMissingBean(QueueClient.class)
  public InMemoryQueueClient queueClient(SqsOfflineProperties props) {
    return new InMemoryQueueClient(props.getRegion(), props.getAccountId());
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public SqsHandlerRegistrar sqsHandlerRegistrar(ListableBeanFactory beanFactory,
      DefaultHandlerRegistry handlerRegistry) {
    return new SqsHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "sqs-offline", name = "handler-roots")
  @ConditionalOnMissingBean
  public ClassDirectoryHandlerLoader classDirectoryHandlerLoader(SqsOfflineProperties props) {
    List<Path> roots = new ArrayList<>();
    for (String root : props.getHandlerRoots()) {
      roots.add(Path.of(root));
    }
    return new ClassDirectoryHandlerLoader(roots);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public SqsOffline sqsOffline(SqsOfflineConfig config,
      QueueClient queueClient,
      ObjectProvider<HandlerLoader> loaderProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    List<HandlerLoader> loaders = loaderProvider.orderedStream().toList();
    if (loaders.isEmpty()) {
      throw new IllegalStateException("No HandlerLoader bean available");
    }
    SqsOffline.Builder builder = SqsOffline.builder()
        .queueClient(queueClient)
        .handlerLoader(loaders.size() == 1 ? loaders.get(0) : new CompositeHandlerLoader(loaders))
        .config(config);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public SqsOfflineLifecycle sqsOfflineLifecycle(SqsOffline sqsOffline) {
    return new SqsOfflineLifecycle(sqsOffline);
  }
}
