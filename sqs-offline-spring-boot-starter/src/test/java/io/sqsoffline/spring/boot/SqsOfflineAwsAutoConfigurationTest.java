package io.sqsoffline.spring.boot;

import io.sqsoffline.aws.SqsQueueClient;
import io.sqsoffline.client.InMemoryQueueClient;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.spi.QueueClient;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class SqsOfflineAwsAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          SqsOfflineAwsAutoConfiguration.class, SqsOfflineAutoConfiguration.class))
      .withPropertyValues("sqs-offline.wait-time-seconds=0", "sqs-offline.drain-timeout=1s");

  @Test
  void usesSqsClientWhenEndpointSet() {
    runner.withPropertyValues("sqs-offline.endpoint=http://localhost:4566").run(ctx -> {
      assertTrue(ctx.containsBean("sqsQueueClient"));
      assertFalse(ctx.containsBean("queueClient"));
      assertInstanceOf(SqsQueueClient.class, ctx.getBean(QueueClient.class));
    });
  }

  @Test
  void staysInMemoryWithoutEndpoint() {
    runner.run(ctx -> {
      assertFalse(ctx.containsBean("sqsQueueClient"));
      assertInstanceOf(InMemoryQueueClient.class, ctx.getBean(QueueClient.class));
    });
  }

  @Test
  void bindsEndpointAndCredentials() {
    runner.withPropertyValues(
            "sqs-offline.endpoint=http://localhost:4566",
            "sqs-offline.access-key-id=local",
            "sqs-offline.secret-access-key=secret")
        .run(ctx -> {
          SqsOfflineConfig config = ctx.getBean(SqsOfflineConfig.class);
          assertEquals("http://localhost:4566", config.endpoint());
          assertEquals("local", config.accessKeyId());
          assertEquals("secret", config.secretAccessKey());
        });
  }

  @Test
  void backsOffWhenCustomQueueClientPresent() {
    runner.withPropertyValues("sqs-offline.endpoint=http://localhost:4566")
        .withUserConfiguration(CustomClientConfig.class)
        .run(ctx -> {
          assertFalse(ctx.containsBean("sqsQueueClient"));
          assertSame(ctx.getBean("customQueueClient"), ctx.getBean(QueueClient.class));
        });
  }

  @Configuration(proxyBeanMethods = false)
  static class CustomClientConfig {
    @Bean
    QueueClient customQueueClient() {
      return new InMemoryQueueClient("us-east-1", "000000000000");
    }
  }
}
