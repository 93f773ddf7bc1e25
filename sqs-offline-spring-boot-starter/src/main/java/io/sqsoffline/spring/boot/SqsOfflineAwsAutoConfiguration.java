package io.sqsoffline.spring.boot;

import io.sqsoffline.aws.SqsQueueClient;
import io.sqsoffline.spi.QueueClient;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for an SQS endpoint such as LocalStack.
 *
 * <p>Creates an {@link SqsQueueClient} when {@code sqs-offline-aws} is on the classpath and
 * {@code sqs-offline.endpoint} is set. Runs before {@link SqsOfflineAutoConfiguration} so the
 * in-memory client backs off.
 */
@AutoConfiguration(before = SqsOfflineAutoConfiguration.class)
@ConditionalOnClass(SqsQueueClient.class)
@ConditionalOnProperty(prefix = "sqs-offline", name = "endpoint")
@EnableConfigurationProperties(SqsOfflineProperties.class)
public class SqsOfflineAwsAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(QueueClient.class)
  public SqsQueueClient sqsQueueClient(SqsOfflineProperties props) {
    return SqsQueueClient.builder()
        .endpoint(props.getEndpoint())
        .region(props.getRegion())
        .credentials(props.getAccessKeyId(), props.getSecretAccessKey())
        .build();
  }
}
