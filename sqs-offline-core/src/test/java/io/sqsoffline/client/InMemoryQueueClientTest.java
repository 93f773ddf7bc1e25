package io.sqsoffline.client;

import io.sqsoffline.model.MessageAttributeValue;
import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.spi.QueueAlreadyExistsException;
import io.sqsoffline.spi.QueueDoesNotExistException;
import io.sqsoffline.spi.QueueOperationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryQueueClientTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
  private final InMemoryQueueClient client = new InMemoryQueueClient("eu-west-1", "123456789012", clock);

  // ── Queues ────────────────────────────────────────────────────

  @Test
  void createReturnsHandleWithArn() {
    QueueHandle handle = client.createQueue("orders", Map.of("VisibilityTimeout", "30"));

    assertEquals("memory://123456789012/orders", handle.url());
    assertEquals("arn:aws:sqs:eu-west-1:123456789012:orders", handle.attributes().get("QueueArn"));
    assertEquals("30", handle.attributes().get("VisibilityTimeout"));
    assertEquals("0", handle.attributes().get("ApproximateNumberOfMessages"));
  }

  @Test
  void recreatingWithSameAttributesIsIdempotent() {
    client.createQueue("orders", Map.of("VisibilityTimeout", "30"));

    QueueHandle again = client.createQueue("orders", Map.of("VisibilityTimeout", "30"));

    assertEquals("orders", again.name());
    assertEquals(1, client.queueNames().size());
  }

  @Test
  void recreatingWithDifferentAttributesFails() {
    client.createQueue("orders", Map.of("VisibilityTimeout", "30"));

    QueueAlreadyExistsException e = assertThrows(QueueAlreadyExistsException.class,
        () -> client.createQueue("orders", Map.of("VisibilityTimeout", "60")));
    assertEquals(QueueOperationException.Operation.CREATE, e.operation());
    assertEquals("orders", e.queueName());
  }

  @Test
  void unknownQueueDoesNotExist() {
    QueueDoesNotExistException e = assertThrows(QueueDoesNotExistException.class, () -> client.getQueueInfo("nope"));

    assertEquals(QueueOperationException.Operation.GET_INFO, e.operation());
  }

  @Test
  void setAttributesMerges() {
    QueueHandle handle = client.createQueue("orders", Map.of("VisibilityTimeout", "30"));

    client.setQueueAttributes(handle, Map.of("DelaySeconds", "5"));

    Map<String, String> attributes = client.getQueueInfo("orders").attributes();
    assertEquals("30", attributes.get("VisibilityTimeout"));
    assertEquals("5", attributes.get("DelaySeconds"));
  }

  // ── Messages ──────────────────────────────────────────────────

  @Test
  void receivedMessageCarriesAttributes() {
    QueueHandle queue = client.createQueue("orders", Map.of());
    String id = client.sendMessage(queue, "hello", Map.of("tenant", MessageAttributeValue.ofString("acme")));

    List<QueueMessage> received = client.receiveMessages(queue, 10, 30, 0);

    assertEquals(1, received.size());
    QueueMessage message = received.get(0);
    assertEquals(id, message.messageId());
    assertEquals("hello", message.body());
    assertEquals("5d41402abc4b2a76b9719d911017c592", message.md5OfBody());
    assertEquals(1, message.deliveryAttemptCount());
    assertEquals(clock.instant(), message.sentAt());
    assertEquals("acme", message.messageAttributes().get("tenant").stringValue());
  }

  @Test
  void receivedMessageIsHiddenUntilVisibilityTimeoutExpires() {
    QueueHandle queue = client.createQueue("orders", Map.of());
    client.sendMessage(queue, "hello", Map.of());

    QueueMessage first = client.receiveMessages(queue, 1, 30, 0).get(0);
    assertTrue(client.receiveMessages(queue, 1, 30, 0).isEmpty());

    clock.advanceSeconds(31);
    QueueMessage second = client.receiveMessages(queue, 1, 30, 0).get(0);

    assertEquals(first.messageId(), second.messageId());
    assertEquals(2, second.deliveryAttemptCount());
    assertNotEquals(first.receiptHandle(), second.receiptHandle());
  }

  @Test
  void deleteRequiresCurrentReceiptHandle() {
    QueueHandle queue = client.createQueue("orders", Map.of());
    client.sendMessage(queue, "hello", Map.of());
    QueueMessage first = client.receiveMessages(queue, 1, 0, 0).get(0);
    QueueMessage second = client.receiveMessages(queue, 1, 0, 0).get(0);

    assertThrows(QueueOperationException.class, () -> client.deleteMessage(queue, first.receiptHandle()));
    client.deleteMessage(queue, second.receiptHandle());

    assertEquals(0, client.size("orders"));
  }

  @Test
  void receiveHonoursMaxMessages() {
    QueueHandle queue = client.createQueue("orders", Map.of());
    for (int i = 0; i < 5; i++) {
      client.sendMessage(queue, "m" + i, Map.of());
    }

    assertEquals(3, client.receiveMessages(queue, 3, 30, 0).size());
    assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), client.bodies("orders"));
    assertThrows(QueueOperationException.class, () -> client.receiveMessages(queue, 11, 30, 0));
  }

  @Test
  void delaySecondsDefersDelivery() {
    QueueHandle queue = client.createQueue("delayed", Map.of("DelaySeconds", "10"));
    client.sendMessage(queue, "later", Map.of());

    assertTrue(client.receiveMessages(queue, 1, 30, 0).isEmpty());
    clock.advanceSeconds(10);

    assertEquals("later", client.receiveMessages(queue, 1, 30, 0).get(0).body());
  }

  @Test
  void longPollWakesOnSend() throws Exception {
    QueueHandle queue = client.createQueue("orders", Map.of());
    CompletableFuture<List<QueueMessage>> pending = CompletableFuture.supplyAsync(
        () -> client.receiveMessages(queue, 1, 30, 5));

    Thread.sleep(100);
    client.sendMessage(queue, "wake", Map.of());

    assertEquals("wake", pending.get(3, TimeUnit.SECONDS).get(0).body());
  }

  @Test
  void defaultConstructorUsesLocalIdentity() {
    QueueHandle handle = new InMemoryQueueClient().createQueue("q", Map.of());

    assertEquals("memory://000000000000/q", handle.url());
    assertEquals("q", handle.name());
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    synchronized void advanceSeconds(long seconds) {
      now = now.plusSeconds(seconds);
    }

    @Override
    public synchronized Instant instant() {
      return now;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }
  }
}
