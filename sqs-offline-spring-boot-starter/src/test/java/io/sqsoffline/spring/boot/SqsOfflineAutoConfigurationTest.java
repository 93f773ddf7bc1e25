package io.sqsoffline.spring.boot;

import io.sqsoffline.SqsOffline;
import io.sqsoffline.client.InMemoryQueueClient;
import io.sqsoffline.config.QueueDescriptor;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.event.SqsEvent;
import io.sqsoffline.invoke.DefaultHandlerRegistry;
import io.sqsoffline.invoke.InvocationContext;
import io.sqsoffline.invoke.QueueHandler;
import io.sqsoffline.spi.QueueClient;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SqsOfflineAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(SqsOfflineAutoConfiguration.class))
      .withPropertyValues(
          "sqs-offline.poll-interval=100ms",
          "sqs-offline.wait-time-seconds=0",
          "sqs-offline.drain-timeout=1s",
          "sqs-offline.queues[0].name=orders",
          "sqs-offline.queues[0].handler=handlers.orders",
          "sqs-offline.queues[0].dead-letter-queue=true",
          "sqs-offline.queues[0].max-receive-count=2");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("sqsOfflineConfig"));
      assertTrue(ctx.containsBean("queueClient"));
      assertTrue(ctx.containsBean("handlerRegistry"));
      assertTrue(ctx.containsBean("sqsHandlerRegistrar"));
      assertTrue(ctx.containsBean("sqsOffline"));
      assertTrue(ctx.containsBean("sqsOfflineLifecycle"));
      assertFalse(ctx.containsBean("classDirectoryHandlerLoader"));

      assertInstanceOf(InMemoryQueueClient.class, ctx.getBean(QueueClient.class));
      assertInstanceOf(SqsOffline.class, ctx.getBean(SqsOffline.class));
    });
  }

  @Test
  void bindsQueueProperties() {
    runner.withUserConfiguration(HandlerConfig.class)
        .withPropertyValues("sqs-offline.region=eu-west-1", "sqs-offline.queues[0].concurrency-limit=4",
            "sqs-offline.queues[0].handler-timeout=5s")
        .run(ctx -> {
          SqsOfflineConfig config = ctx.getBean(SqsOfflineConfig.class);
          assertEquals("eu-west-1", config.region());
          assertEquals(Duration.ofMillis(100), config.pollInterval());
          QueueDescriptor orders = config.queues().get(0);
          assertEquals("orders", orders.name());
          assertEquals("handlers.orders", orders.handlerRef());
          assertEquals(4, orders.concurrencyLimit());
          assertEquals(Duration.ofSeconds(5), orders.handlerTimeout());
          assertEquals(2, orders.maxDeliveryAttempts());
          assertTrue(orders.deadLetterPolicy().enabled());
          assertEquals("orders-dlq", orders.deadLetterPolicy().queueName());
        });
  }

  @Test
  void registersAnnotatedHandlers() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      DefaultHandlerRegistry registry = ctx.getBean(DefaultHandlerRegistry.class);
      assertEquals(Set.of("handlers.orders"), registry.handlerRefs());
    });
  }

  @Test
  void provisionsAndPollsOnStartup() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      InMemoryQueueClient client = ctx.getBean(InMemoryQueueClient.class);
      assertEquals(Set.of("orders", "orders-dlq"), client.queueNames());
      assertTrue(ctx.getBean(SqsOffline.class).isPolling());
      assertTrue(ctx.getBean(SqsOfflineLifecycle.class).lastReport().isSuccess());

      client.sendMessage(client.getQueueInfo("orders"), "order-1", Map.of());

      RecordingHandler handler = ctx.getBean(RecordingHandler.class);
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (client.size("orders") > 0 && System.nanoTime() < deadline) {
        Thread.sleep(20);
      }
      assertEquals(List.of("order-1"), handler.bodies);
      assertEquals(0, client.size("orders"));
    });
  }

  @Test
  void notLoadedWhenDisabled() {
    runner.withPropertyValues("sqs-offline.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("sqsOffline"));
    });
  }

  @Test
  void respectsCustomQueueClient() {
    runner.withUserConfiguration(HandlerConfig.class, CustomClientConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("queueClient"));
      assertEquals("customClient", ctx.getBeanNamesForType(QueueClient.class)[0]);
      assertTrue(ctx.getBean(InMemoryQueueClient.class).queueNames().contains("orders"));
    });
  }

  @Test
  void failsOnQueueWithoutHandler() {
    runner.withPropertyValues("sqs-offline.queues[1].name=lonely").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
    });
  }

  @Test
  void createsClassDirectoryLoaderForHandlerRoots() {
    runner.withUserConfiguration(HandlerConfig.class)
        .withPropertyValues("sqs-offline.handler-roots=build/handlers")
        .run(ctx -> {
          assertTrue(ctx.containsBean("classDirectoryHandlerLoader"));
          assertTrue(ctx.getBean(SqsOffline.class).isPolling());
        });
  }

  // ── Test configurations ──────────────────────────────────────

  @SqsHandler("handlers.orders")
  static class RecordingHandler implements QueueHandler {
    final List<String> bodies = new CopyOnWriteArrayList<>();

    @Override
    public Object handle(SqsEvent event, InvocationContext context) {
      event.records().forEach(record -> bodies.add(record.body()));
      return null;
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    RecordingHandler recordingHandler() {
      return new RecordingHandler();
    }
  }

  @Configuration
  static class CustomClientConfig {
    @Bean
    QueueClient customClient() {
      return new InMemoryQueueClient("eu-central-1", "111111111111");
    }
  }
}
