package io.sqsoffline.demo;

import io.sqsoffline.SqsOffline;
import io.sqsoffline.client.InMemoryQueueClient;
import io.sqsoffline.config.QueueDescriptor;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.delivery.PollerStatus;
import io.sqsoffline.invoke.CallbackQueueHandler;
import io.sqsoffline.invoke.DefaultHandlerRegistry;
import io.sqsoffline.invoke.QueueHandler;
import io.sqsoffline.model.MessageAttributeValue;
import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.provision.ProvisioningReport;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Simple demo showing the emulator without Spring: two queues, one of them with a
 * dead-letter queue, backed by the in-memory client.
 *
 * Run with: mvn -pl samples/sqs-offline-demo exec:java
 */
public final class SqsOfflineDemo {

  public static void main(String[] args) throws Exception {
    // 1. Embedded backend
    InMemoryQueueClient client = new InMemoryQueueClient();

    // Track handled messages: two orders and one notification
    CountDownLatch handled = new CountDownLatch(3);

    // 2. Handlers
    DefaultHandlerRegistry handlers = new DefaultHandlerRegistry()
        .register("handlers/orders.process", (QueueHandler) (event, context) -> {
          String body = event.records().get(0).body();
          System.out.println("[orders] " + context.awsRequestId() + " body=" + body
              + " attempt=" + event.records().get(0).attributes().get("ApproximateReceiveCount"));
          if (body.contains("\"poison\"")) {
            throw new IllegalArgumentException("Cannot process poison order");
          }
          handled.countDown();
          return null;
        })
        .register("handlers/notify.send", (CallbackQueueHandler) (event, context, callback) -> {
          System.out.println("[notify] " + event.records().get(0).body());
          handled.countDown();
          callback.success("sent");
        });

    // 3. Configuration: short timeouts so retries happen quickly
    SqsOfflineConfig config = SqsOfflineConfig.builder()
        .pollInterval(Duration.ofMillis(200))
        .waitTimeSeconds(0)
        .visibilityTimeoutSeconds(0)
        .queue(QueueDescriptor.builder("orders", "handlers/orders.process")
            .deadLetterQueue(true)
            .maxDeliveryAttempts(2))
        .queue(QueueDescriptor.builder("notifications", "handlers/notify.send"))
        .build();

    System.out.println("=== sqs-offline Demo ===\n");

    try (SqsOffline sqsOffline = SqsOffline.builder()
        .queueClient(client)
        .handlerLoader(handlers)
        .config(config)
        .build()) {
      // 4. Provision queues and start polling
      ProvisioningReport report = sqsOffline.start();
      System.out.println("Provisioned: " + report.provisioned().stream().map(QueueHandle::name).toList() + "\n");

      // 5. Send messages
      QueueHandle orders = client.getQueueInfo("orders");
      QueueHandle notifications = client.getQueueInfo("notifications");
      client.sendMessage(orders, "{\"orderId\": 1}", Map.of());
      client.sendMessage(orders, "{\"orderId\": 2}", Map.of("priority", MessageAttributeValue.ofNumber("5")));
      client.sendMessage(orders, "{\"orderId\": \"poison\"}", Map.of());
      client.sendMessage(notifications, "{\"to\": \"alice@example.com\"}", Map.of());

      // 6. Wait for processing and for the poison message to be redriven
      boolean completed = handled.await(10, TimeUnit.SECONDS);
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
      while (client.size("orders-dlq") == 0 && System.nanoTime() < deadline) {
        Thread.sleep(100);
      }
      System.out.println(completed ? "\nAll messages handled." : "\nTimeout waiting for messages.");

      // 7. Show final state
      System.out.println("\n=== Queue State ===");
      for (String name : List.of("orders", "orders-dlq", "notifications")) {
        System.out.println(name + ": " + client.size(name) + " message(s)");
      }
      for (String body : client.bodies("orders-dlq")) {
        System.out.println("  DLQ: " + body);
      }

      System.out.println("\n=== Pollers ===");
      for (PollerStatus status : sqsOffline.pollerStates().values()) {
        System.out.println(status.pollerId() + " state=" + status.state()
            + " processed=" + status.messagesProcessed()
            + " errors=" + status.errorCount()
            + (status.lastError() != null ? " lastError=" + status.lastError() : ""));
      }
    }

    System.out.println("\nDemo complete.");
  }
}
