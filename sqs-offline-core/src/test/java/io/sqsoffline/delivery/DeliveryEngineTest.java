package io.sqsoffline.delivery;

import io.sqsoffline.config.QueueDescriptor;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.invoke.DefaultHandlerRegistry;
import io.sqsoffline.invoke.HandlerInvoker;
import io.sqsoffline.invoke.QueueHandler;
import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.spi.MetricsExporter;
import io.sqsoffline.spi.QueueOperationException;
import io.sqsoffline.spi.StubQueueClient;
import io.sqsoffline.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static io.sqsoffline.spi.StubQueueClient.message;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryEngineTest {

  private final StubQueueClient client = new StubQueueClient();
  private final DefaultHandlerRegistry handlers = new DefaultHandlerRegistry();
  private final CountingMetrics metrics = new CountingMetrics();
  private HandlerInvoker invoker;
  private DeliveryEngine engine;

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.close();
    }
    if (invoker != null) {
      invoker.close();
    }
  }

  private DeliveryEngine engine(QueueDescriptor.Builder... queues) {
    SqsOfflineConfig config = SqsOfflineConfig.builder()
        .pollInterval(Duration.ofMillis(100))
        .queues(List.of(queues))
        .build();
    invoker = HandlerInvoker.builder().loader(handlers).config(config).build();
    engine = DeliveryEngine.builder()
        .queueClient(client)
        .invoker(invoker)
        .config(config)
        .metrics(metrics)
        .build();
    return engine;
  }

  private static QueueDescriptor.Builder orders() {
    return QueueDescriptor.builder("orders", "handlers.orders");
  }

  private void failingHandler(String reason) {
    handlers.register("handlers.orders", (QueueHandler) (event, context) -> {
      throw new IllegalStateException(reason);
    });
  }

  private PollerStatus status(String pollerId) {
    return engine.pollerStates().get(pollerId);
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 5s");
      }
      Thread.sleep(20);
    }
  }

  // ── Settlement ────────────────────────────────────────────────

  @Test
  void successDeletesMessageOnce() {
    handlers.register("handlers.orders", (QueueHandler) (event, context) -> "ok");
    client.enqueue("orders", message("m1", 1));

    engine(orders()).pollNow("orders");

    assertEquals(List.of("rh-m1"), client.deleted);
    assertTrue(client.sent.isEmpty());
    assertEquals(1, metrics.success.get());
    PollerStatus status = status("orders-handlers.orders");
    assertEquals(1, status.messagesProcessed());
    assertEquals(0, status.errorCount());
  }

  @Test
  void failureBelowThresholdLeavesMessageForRedelivery() {
    failingHandler("boom");
    client.enqueue("orders", message("m1", 2));

    engine(orders().deadLetterQueue(true).maxDeliveryAttempts(3)).pollNow("orders");

    assertTrue(client.deleted.isEmpty());
    assertTrue(client.sent.isEmpty());
    PollerStatus status = status("orders-handlers.orders");
    assertEquals(1, status.errorCount());
    assertEquals("boom", status.lastError());
    assertEquals(1, metrics.failure.get());
  }

  @Test
  void failureAtThresholdMovesMessageToDeadLetterQueue() {
    failingHandler("boom");
    client.enqueue("orders", message("m1", 3));

    engine(orders().deadLetterQueue(true).maxDeliveryAttempts(3)).pollNow("orders");

    assertEquals(1, client.sent.size());
    StubQueueClient.SentMessage sent = client.sent.get(0);
    assertEquals("orders-dlq", sent.queueName());
    Map<String, Object> envelope = JsonCodec.getDefault().parseObject(sent.body());
    assertEquals("orders", envelope.get("queueName"));
    assertEquals("handlers.orders", envelope.get("handler"));
    assertEquals("boom", envelope.get("failureReason"));
    assertTrue(envelope.get("failureTime") instanceof String);
    Map<?, ?> original = (Map<?, ?>) envelope.get("originalMessage");
    assertEquals("m1", original.get("MessageId"));
    assertEquals("body-m1", original.get("Body"));
    assertEquals(List.of("rh-m1"), client.deleted);
    assertEquals(1, metrics.deadLettered.get());
  }

  @Test
  void failureWithoutDeadLetterQueueRetriesIndefinitely() {
    failingHandler("boom");
    client.enqueue("orders", message("m1", 5));

    engine(orders().maxDeliveryAttempts(3)).pollNow("orders");

    assertTrue(client.sent.isEmpty());
    assertTrue(client.deleted.isEmpty());
  }

  @Test
  void failedDeadLetterSendKeepsOriginal() {
    failingHandler("boom");
    client.failSend = true;
    client.enqueue("orders", message("m1", 3));

    engine(orders().deadLetterQueue(true).maxDeliveryAttempts(3)).pollNow("orders");

    assertTrue(client.deleted.isEmpty());
    assertEquals(0, metrics.deadLettered.get());
  }

  @Test
  void deleteFailureIsCountedNotThrown() {
    handlers.register("handlers.orders", (QueueHandler) (event, context) -> "ok");
    client.failDelete = true;
    client.enqueue("orders", message("m1", 1));

    engine(orders()).pollNow("orders");

    assertEquals(1, metrics.deleteErrors.get());
  }

  @Test
  void slowHandlerTimesOutAndStaysOnQueue() {
    handlers.register("handlers.slow", (QueueHandler) (event, context) -> {
      Thread.sleep(10_000);
      return null;
    });
    client.enqueue("slow", message("m1", 1));

    long start = System.nanoTime();
    engine(QueueDescriptor.builder("slow", "handlers.slow").handlerTimeout(Duration.ofSeconds(1))).pollNow("slow");
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(elapsedMs < 5_000, "took " + elapsedMs + "ms");
    assertTrue(client.deleted.isEmpty());
    assertEquals(1, metrics.timeouts.get());
    assertTrue(status("slow-handlers.slow").lastError().contains("timed out"));
  }

  @Test
  void receiveErrorIsCounted() {
    handlers.register("handlers.orders", (QueueHandler) (event, context) -> "ok");
    client.receiveError = new QueueOperationException(QueueOperationException.Operation.RECEIVE, "orders", "unreachable");

    engine(orders()).pollNow("orders");

    PollerStatus status = status("orders-handlers.orders");
    assertEquals(1, status.errorCount());
    assertEquals("unreachable", status.lastError());
    assertEquals(1, metrics.receiveErrors.get());
  }

  // ── Concurrency ───────────────────────────────────────────────

  @Test
  void subBatchesRunStrictlyInSequence() {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    Map<String, long[]> spans = new ConcurrentHashMap<>();
    handlers.register("handlers.orders", (QueueHandler) (event, context) -> {
      long started = System.nanoTime();
      int now = running.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      Thread.sleep(100);
      running.decrementAndGet();
      spans.put(event.records().get(0).messageId(), new long[] {started, System.nanoTime()});
      return null;
    });
    client.enqueue("orders", message("m1", 1), message("m2", 1), message("m3", 1),
        message("m4", 1), message("m5", 1), message("m6", 1));

    engine(orders().batchSize(10).concurrencyLimit(2)).pollNow("orders");

    assertEquals(2, peak.get());
    assertEquals(6, spans.size());
    assertStartsAfter(spans, List.of("m3", "m4"), List.of("m1", "m2"));
    assertStartsAfter(spans, List.of("m5", "m6"), List.of("m3", "m4"));
    assertEquals(List.of("rh-m1", "rh-m2", "rh-m3", "rh-m4", "rh-m5", "rh-m6"), List.copyOf(client.deleted).stream().sorted().toList());
    assertEquals(6, status("orders-handlers.orders").messagesProcessed());
  }

  private static void assertStartsAfter(Map<String, long[]> spans, List<String> later, List<String> earlier) {
    long lastEnd = earlier.stream().mapToLong(id -> spans.get(id)[1]).max().orElseThrow();
    long firstStart = later.stream().mapToLong(id -> spans.get(id)[0]).min().orElseThrow();
    assertTrue(firstStart >= lastEnd, later + " started before " + earlier + " finished");
  }

  @Test
  void restartWhileCycleInFlightKeepsConcurrencyLimit() throws Exception {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    CountDownLatch firstStarted = new CountDownLatch(1);
    handlers.register("handlers.orders", (QueueHandler) (event, context) -> {
      int now = running.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      firstStarted.countDown();
      Thread.sleep(400);
      running.decrementAndGet();
      return null;
    });
    client.enqueue("orders", message("a1", 1), message("a2", 1), message("a3", 1), message("a4", 1));
    client.enqueue("orders", message("b1", 1), message("b2", 1), message("b3", 1), message("b4", 1));
    DeliveryEngine engine = engine(orders().batchSize(4).concurrencyLimit(2));
    List<QueueDescriptor> queues = SqsOfflineConfig.builder()
        .queue(orders().batchSize(4).concurrencyLimit(2)).build().queues();

    engine.startPolling(queues);
    assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
    engine.stopPolling();
    engine.startPolling(queues);

    await(() -> client.deleted.size() == 8);
    assertTrue(peak.get() <= 2, "peak=" + peak.get());
    assertEquals(LoopState.POLLING, engine.loopState("orders", "handlers.orders"));
  }

  @Test
  void partitionsIntoOrderedChunks() {
    assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), DeliveryEngine.partition(List.of(1, 2, 3, 4, 5), 2));
    assertEquals(List.of(), DeliveryEngine.partition(List.of(), 3));
    assertThrows(IllegalArgumentException.class, () -> DeliveryEngine.partition(List.of(1), 0));
  }

  // ── Lifecycle ─────────────────────────────────────────────────

  @Test
  void pollingLoopDeliversMessages() throws Exception {
    CountDownLatch handled = new CountDownLatch(1);
    handlers.register("handlers.orders", (QueueHandler) (event, context) -> {
      handled.countDown();
      return null;
    });
    client.enqueue("orders", message("m1", 1));
    DeliveryEngine engine = engine(orders());

    engine.startPolling(SqsOfflineConfig.builder().queue(orders()).build().queues());

    assertTrue(handled.await(5, TimeUnit.SECONDS));
    await(() -> client.deleted.size() == 1);
    assertTrue(engine.isPolling());
    assertEquals(LoopState.POLLING, engine.loopState("orders", "handlers.orders"));
  }

  @Test
  void startingTwiceKeepsOneLoop() throws Exception {
    DeliveryEngine engine = engine(orders());
    List<QueueDescriptor> queues = SqsOfflineConfig.builder().queue(orders()).build().queues();

    engine.startPolling(queues);
    engine.startPolling(queues);
    await(() -> client.receiveCalls.get() > 0);

    assertEquals(1, engine.pollerStates().size());
    assertEquals(1, client.calls.stream().filter("info:orders"::equals).count());
  }

  @Test
  void stopPollingIsIdempotent() throws Exception {
    DeliveryEngine engine = engine(orders());
    engine.startPolling(SqsOfflineConfig.builder().queue(orders()).build().queues());
    await(() -> client.receiveCalls.get() > 0);

    engine.stopPolling();
    engine.stopPolling();

    assertFalse(engine.isPolling());
    assertEquals(LoopState.STOPPED, engine.loopState("orders", "handlers.orders"));
    int receives = client.receiveCalls.get();
    Thread.sleep(300);
    assertTrue(client.receiveCalls.get() <= receives + 1);
  }

  @Test
  void disabledQueuesAreSkipped() {
    DeliveryEngine engine = engine(orders());

    engine.startPolling(SqsOfflineConfig.builder().queue(orders().enabled(false)).build().queues());

    assertTrue(engine.pollerStates().isEmpty());
    assertFalse(engine.isPolling());
  }

  @Test
  void pollNowRejectsUnknownQueue() {
    assertThrows(IllegalArgumentException.class, () -> engine(orders()).pollNow("unknown"));
  }

  @Test
  void closedEngineRefusesToStart() {
    DeliveryEngine engine = engine(orders());
    engine.close();

    assertThrows(IllegalStateException.class, () -> engine.startPolling(List.of()));
  }

  private static final class CountingMetrics implements MetricsExporter {
    final AtomicInteger received = new AtomicInteger();
    final AtomicInteger success = new AtomicInteger();
    final AtomicInteger failure = new AtomicInteger();
    final AtomicInteger deadLettered = new AtomicInteger();
    final AtomicInteger receiveErrors = new AtomicInteger();
    final AtomicInteger timeouts = new AtomicInteger();
    final AtomicInteger deleteErrors = new AtomicInteger();

    @Override
    public void incrementMessagesReceived(String queueName, int count) {
      received.addAndGet(count);
    }

    @Override
    public void incrementHandlerSuccess(String queueName) {
      success.incrementAndGet();
    }

    @Override
    public void incrementHandlerFailure(String queueName) {
      failure.incrementAndGet();
    }

    @Override
    public void incrementDeadLettered(String queueName) {
      deadLettered.incrementAndGet();
    }

    @Override
    public void incrementReceiveErrors(String queueName) {
      receiveErrors.incrementAndGet();
    }

    @Override
    public void incrementHandlerTimeout(String queueName) {
      timeouts.incrementAndGet();
    }

    @Override
    public void incrementDeleteErrors(String queueName) {
      deleteErrors.incrementAndGet();
    }
  }
}
