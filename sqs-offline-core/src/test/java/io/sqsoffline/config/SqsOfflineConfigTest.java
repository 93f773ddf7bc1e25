package io.sqsoffline.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqsOfflineConfigTest {

  @Test
  void defaults() {
    SqsOfflineConfig config = SqsOfflineConfig.defaults();

    assertTrue(config.enabled());
    assertEquals("us-east-1", config.region());
    assertEquals("000000000000", config.accountId());
    assertNull(config.endpoint());
    assertEquals("test", config.accessKeyId());
    assertEquals("test", config.secretAccessKey());
    assertTrue(config.autoCreate());
    assertEquals(Duration.ofMillis(1000), config.pollInterval());
    assertEquals(3, config.maxConcurrentPolls());
    assertEquals(30, config.visibilityTimeoutSeconds());
    assertEquals(20, config.waitTimeSeconds());
    assertEquals(3, config.maxReceiveCount());
    assertEquals("-dlq", config.deadLetterQueueSuffix());
    assertFalse(config.skipCacheInvalidation());
    assertEquals(Duration.ofSeconds(30), config.handlerTimeout());
    assertEquals(1, config.batchSize());
    assertEquals(Duration.ofSeconds(5), config.drainTimeout());
    assertTrue(config.queues().isEmpty());
  }

  @Test
  void endpointAndCredentials() {
    SqsOfflineConfig config = SqsOfflineConfig.builder()
        .endpoint("http://localhost:4566")
        .accessKeyId("key")
        .secretAccessKey("secret")
        .build();

    assertEquals("http://localhost:4566", config.endpoint());
    assertEquals("key", config.accessKeyId());
    assertEquals("secret", config.secretAccessKey());
    assertNull(SqsOfflineConfig.builder().endpoint("  ").build().endpoint());
    assertThrows(NullPointerException.class, () -> SqsOfflineConfig.builder().accessKeyId(null).build());
  }

  // ── Validation ──────────────────────────────────────────────────

  @Test
  void rejectsPollIntervalBelowMinimum() {
    assertThrows(IllegalArgumentException.class, () ->
        SqsOfflineConfig.builder().pollInterval(Duration.ofMillis(99)).build());
  }

  @Test
  void acceptsMinimumPollInterval() {
    assertEquals(100, SqsOfflineConfig.builder().pollInterval(Duration.ofMillis(100)).build().pollInterval().toMillis());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().maxConcurrentPolls(0).build());
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().visibilityTimeoutSeconds(-1).build());
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().visibilityTimeoutSeconds(43_201).build());
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().waitTimeSeconds(21).build());
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().maxReceiveCount(0).build());
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().batchSize(11).build());
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().handlerTimeout(Duration.ofMillis(999)).build());
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder().handlerTimeout(Duration.ofSeconds(901)).build());
  }

  @Test
  void rejectsNullRegion() {
    assertThrows(NullPointerException.class, () -> SqsOfflineConfig.builder().region(null).build());
  }

  @Test
  void rejectsDuplicateQueueNames() {
    assertThrows(IllegalArgumentException.class, () -> SqsOfflineConfig.builder()
        .queue(QueueDescriptor.builder("orders", "a.handle"))
        .queue(QueueDescriptor.builder("orders", "b.handle"))
        .build());
  }

  // ── Queue resolution ────────────────────────────────────────────

  @Test
  void queuesInheritGlobalDefaults() {
    SqsOfflineConfig config = SqsOfflineConfig.builder()
        .maxConcurrentPolls(5)
        .visibilityTimeoutSeconds(60)
        .waitTimeSeconds(0)
        .maxReceiveCount(4)
        .batchSize(10)
        .handlerTimeout(Duration.ofSeconds(2))
        .deadLetterQueueSuffix("-dead")
        .queue(QueueDescriptor.builder("orders", "handlers.Orders.process").deadLetterQueue(true))
        .build();

    QueueDescriptor orders = config.queues().get(0);
    assertEquals(5, orders.concurrencyLimit());
    assertEquals(60, orders.visibilityTimeoutSeconds());
    assertEquals(0, orders.longPollWaitSeconds());
    assertEquals(4, orders.maxDeliveryAttempts());
    assertEquals(10, orders.batchSize());
    assertEquals(Duration.ofSeconds(2), orders.handlerTimeout());
    assertEquals(new DeadLetterPolicy(true, 4, "orders-dead"), orders.deadLetterPolicy());
  }

  @Test
  void queueOverridesWin() {
    SqsOfflineConfig config = SqsOfflineConfig.builder()
        .queues(List.of(QueueDescriptor.builder("orders", "handlers.Orders.process")
            .concurrencyLimit(2)
            .batchSize(6)
            .maxDeliveryAttempts(7)
            .deadLetterQueue(true)
            .deadLetterQueueName("orders-graveyard")
            .handlerTimeout(Duration.ofSeconds(1))))
        .build();

    QueueDescriptor orders = config.queues().get(0);
    assertEquals(2, orders.concurrencyLimit());
    assertEquals(6, orders.batchSize());
    assertEquals(7, orders.maxDeliveryAttempts());
    assertEquals("orders-graveyard", orders.deadLetterPolicy().queueName());
    assertEquals(Duration.ofSeconds(1), orders.handlerTimeout());
    assertEquals("orders-handlers.Orders.process", orders.pollerId());
  }

  @Test
  void queueValidationAppliesToOverrides() {
    assertThrows(IllegalArgumentException.class, () ->
        QueueDescriptor.builder("orders", "o.handle").batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () ->
        QueueDescriptor.builder("orders", "o.handle").concurrencyLimit(0).build());
    assertThrows(IllegalArgumentException.class, () ->
        QueueDescriptor.builder("orders", "o.handle").maxDeliveryAttempts(0).build());
    assertThrows(NullPointerException.class, () ->
        QueueDescriptor.builder(null, "o.handle").build());
    assertThrows(IllegalArgumentException.class, () ->
        QueueDescriptor.builder("orders", " ").build());
  }

  @Test
  void deadLetterDisabledByDefault() {
    QueueDescriptor orders = QueueDescriptor.builder("orders", "o.handle").build();

    assertFalse(orders.deadLetterPolicy().enabled());
    assertEquals("orders-dlq", orders.deadLetterPolicy().queueName());
    assertEquals(3, orders.maxDeliveryAttempts());
  }
}
