package io.sqsoffline.delivery;

import io.sqsoffline.config.DeadLetterPolicy;
import io.sqsoffline.config.QueueDescriptor;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.event.EventBuilder;
import io.sqsoffline.invoke.HandlerInvoker;
import io.sqsoffline.invoke.InvocationOutcome;
import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.provision.QueueRegistry;
import io.sqsoffline.spi.MetricsExporter;
import io.sqsoffline.spi.QueueClient;
import io.sqsoffline.util.DaemonThreadFactory;
import io.sqsoffline.util.JsonCodec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls queues and dispatches each message to its handler.
 *
 * <p>One polling loop runs per {@code (queueName, handlerRef)}. Every {@code pollInterval}
 * (first pull immediately) a loop receives up to {@code batchSize} messages, splits them into
 * sub-batches of at most {@code concurrencyLimit}, and runs the sub-batches one after another
 * with every message of a sub-batch invoked concurrently. Outcomes:
 * <ul>
 *   <li><b>Success</b>: the message is deleted.</li>
 *   <li><b>Failure below the attempt threshold</b>: nothing; the backend redelivers it once
 *       the visibility timeout expires.</li>
 *   <li><b>Failure at or above the threshold, dead-letter queue enabled</b>: a
 *       {@link DeadLetterEnvelope} is sent to the dead-letter queue, then the original is
 *       deleted. If the send fails, the original stays.</li>
 *   <li><b>Failure at or above the threshold, no dead-letter queue</b>: left for
 *       redelivery, so it is retried indefinitely.</li>
 * </ul>
 *
 * <p>Errors never escape a loop: they are logged, counted in {@link PollerStatus#errorCount()}
 * and the loop carries on. Cycles of one loop never overlap; a tick arriving while the previous
 * cycle still runs is skipped.
 *
 * <p>Threads: one daemon scheduler ({@code sqs-offline-scheduler-N}) and a cached daemon pool
 * running cycles ({@code sqs-offline-poller-N}). Handlers run on the {@link HandlerInvoker}'s
 * pool.
 *
 * <p>Create instances via {@link #builder()}. The lifecycle methods are synchronized.
 */
public final class DeliveryEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryEngine.class.getName());

  private final QueueClient queueClient;
  private final HandlerInvoker invoker;
  private final QueueRegistry registry;
  private final SqsOfflineConfig config;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final EventBuilder eventBuilder;
  private final Map<String, QueuePoller> pollers = new ConcurrentHashMap<>();

  private ScheduledExecutorService scheduler;
  private ExecutorService cyclePool;
  private volatile boolean closed;

  private DeliveryEngine(Builder builder) {
    this.queueClient = Objects.requireNonNull(builder.queueClient, "queueClient");
    this.invoker = Objects.requireNonNull(builder.invoker, "invoker");
    this.registry = builder.registry != null ? builder.registry : new QueueRegistry();
    this.config = builder.config != null ? builder.config : SqsOfflineConfig.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.eventBuilder = new EventBuilder(config.region(), config.accountId());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts one polling loop per enabled descriptor. Disabled descriptors are skipped.
   * A loop already running for the same {@code (queueName, handlerRef)} is left alone.
   *
   * @param descriptors the queues to poll
   * @throws IllegalStateException if the engine has been closed
   */
  public synchronized void startPolling(List<QueueDescriptor> descriptors) {
    if (closed) {
      throw new IllegalStateException("DeliveryEngine has been closed");
    }
    for (QueueDescriptor descriptor : descriptors) {
      if (!descriptor.enabled()) {
        logger.fine("Skipping disabled queue " + descriptor.name());
        continue;
      }
      startLoop(descriptor);
    }
  }

  private void startLoop(QueueDescriptor descriptor) {
    String pollerId = descriptor.pollerId();
    QueuePoller existing = pollers.get(pollerId);
    PollerState state = existing != null ? existing.state() : new PollerState();
    if (!state.transition(LoopState.STOPPED, LoopState.STARTING)) {
      logger.warning("Poller already running: " + pollerId);
      return;
    }
    // A cycle of the previous loop may still be running; sharing its lock keeps cycles serial.
    QueuePoller poller = existing != null
        ? new QueuePoller(descriptor, state, existing.cycleLock())
        : new QueuePoller(descriptor, state);
    pollers.put(pollerId, poller);

    QueueHandle queue;
    try {
      queue = registry.resolve(descriptor.name(), queueClient);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to resolve queue " + descriptor.name() + ", poller not started", e);
      poller.state().error(messageOf(e));
      poller.state().state(LoopState.STOPPED);
      return;
    }
    poller.queue(queue);
    poller.state().state(LoopState.POLLING);
    ensureExecutors();
    long intervalMs = config.pollInterval().toMillis();
    poller.schedule(scheduler.scheduleWithFixedDelay(() -> tick(poller), 0, intervalMs, TimeUnit.MILLISECONDS));
    logger.info("Started polling queue " + descriptor.name() + " with handler " + descriptor.handlerRef());
  }

  private void ensureExecutors() {
    if (scheduler == null) {
      scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("sqs-offline-scheduler-"));
    }
    if (cyclePool == null) {
      cyclePool = Executors.newCachedThreadPool(new DaemonThreadFactory("sqs-offline-poller-"));
    }
  }

  private void tick(QueuePoller poller) {
    if (closed || poller.state().state() != LoopState.POLLING) {
      return;
    }
    try {
      cyclePool.execute(() -> {
        if (!poller.cycleLock().tryLock()) {
          logger.fine(() -> "Previous cycle still running for " + poller.pollerId() + ", skipping tick");
          return;
        }
        try {
          runCycle(poller);
        } finally {
          poller.cycleLock().unlock();
        }
      });
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Cycle pool rejected tick for " + poller.pollerId(), e);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Tick failed for " + poller.pollerId(), t);
    }
  }

  /**
   * Runs one cycle synchronously for every loop of {@code queueName}, waiting for a cycle in
   * progress to finish first. A queue declared in the configuration but never started gets a
   * stopped loop created for it.
   *
   * @param queueName the queue
   * @throws IllegalArgumentException if the queue is neither started nor configured
   * @throws io.sqsoffline.spi.QueueOperationException if the queue cannot be resolved
   */
  public void pollNow(String queueName) {
    List<QueuePoller> matching = new ArrayList<>();
    for (QueuePoller poller : pollers.values()) {
      if (poller.descriptor().name().equals(queueName)) {
        matching.add(poller);
      }
    }
    if (matching.isEmpty()) {
      for (QueueDescriptor descriptor : config.queues()) {
        if (descriptor.name().equals(queueName)) {
          matching.add(pollers.computeIfAbsent(descriptor.pollerId(), id -> new QueuePoller(descriptor, new PollerState())));
        }
      }
    }
    if (matching.isEmpty()) {
      throw new IllegalArgumentException("No poller for queue " + queueName);
    }
    for (QueuePoller poller : matching) {
      if (poller.queue() == null) {
        poller.queue(registry.resolve(queueName, queueClient));
      }
      poller.cycleLock().lock();
      try {
        runCycle(poller);
      } finally {
        poller.cycleLock().unlock();
      }
    }
  }

  private void runCycle(QueuePoller poller) {
    QueueDescriptor descriptor = poller.descriptor();
    QueueHandle queue = poller.queue();
    PollerState state = poller.state();
    state.polled(Instant.now());

    List<QueueMessage> messages;
    try {
      messages = queueClient.receiveMessages(queue, descriptor.batchSize(),
          descriptor.visibilityTimeoutSeconds(), descriptor.longPollWaitSeconds());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to receive messages from " + descriptor.name(), e);
      metrics.incrementReceiveErrors(descriptor.name());
      state.error(messageOf(e));
      return;
    }
    if (messages == null || messages.isEmpty()) {
      return;
    }
    logger.fine(() -> "Received " + messages.size() + " message(s) from " + descriptor.name());
    metrics.incrementMessagesReceived(descriptor.name(), messages.size());
    state.processed(messages.size());

    try {
      for (List<QueueMessage> subBatch : partition(messages, descriptor.concurrencyLimit())) {
        if (closed) {
          break;
        }
        processSubBatch(poller, subBatch);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Poll cycle failed for " + descriptor.name(), t);
      state.error(messageOf(t));
    }
  }

  private void processSubBatch(QueuePoller poller, List<QueueMessage> subBatch) {
    QueueDescriptor descriptor = poller.descriptor();
    List<CompletableFuture<InvocationOutcome>> outcomes = new ArrayList<>(subBatch.size());
    for (QueueMessage message : subBatch) {
      outcomes.add(invoker.invoke(descriptor.handlerRef(),
          eventBuilder.buildEvent(descriptor.name(), message), descriptor.handlerTimeout()));
    }
    CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0])).join();
    for (int i = 0; i < subBatch.size(); i++) {
      settle(poller, subBatch.get(i), outcomes.get(i).join());
    }
  }

  private void settle(QueuePoller poller, QueueMessage message, InvocationOutcome outcome) {
    QueueDescriptor descriptor = poller.descriptor();
    metrics.recordHandlerDurationMs(descriptor.name(), outcome.duration().toMillis());
    if (outcome instanceof InvocationOutcome.Success) {
      metrics.incrementHandlerSuccess(descriptor.name());
      try {
        queueClient.deleteMessage(poller.queue(), message.receiptHandle());
        logger.fine(() -> "Processed message " + message.messageId() + " from " + descriptor.name());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to delete message " + message.messageId() + " from " + descriptor.name(), e);
        metrics.incrementDeleteErrors(descriptor.name());
      }
      return;
    }

    InvocationOutcome.Failure failure = (InvocationOutcome.Failure) outcome;
    metrics.incrementHandlerFailure(descriptor.name());
    if (failure.timedOut()) {
      metrics.incrementHandlerTimeout(descriptor.name());
    }
    poller.state().error(failure.reason());

    int attempts = message.deliveryAttemptCount();
    int maxAttempts = descriptor.maxDeliveryAttempts();
    logger.warning("Message " + message.messageId() + " failed processing (attempt " + attempts + "/"
        + maxAttempts + "): " + failure.reason());
    if (attempts < maxAttempts) {
      return;
    }
    DeadLetterPolicy deadLetter = descriptor.deadLetterPolicy();
    if (!deadLetter.enabled()) {
      logger.warning("Message " + message.messageId() + " reached " + attempts
          + " attempts on " + descriptor.name() + " with no dead-letter queue; leaving it for redelivery");
      return;
    }
    redrive(poller, message, failure, deadLetter);
  }

  private void redrive(QueuePoller poller, QueueMessage message, InvocationOutcome.Failure failure,
                       DeadLetterPolicy deadLetter) {
    QueueDescriptor descriptor = poller.descriptor();
    try {
      QueueHandle dlq = registry.resolve(deadLetter.queueName(), queueClient);
      DeadLetterEnvelope envelope = new DeadLetterEnvelope(message, failure.reason(), Instant.now(),
          descriptor.name(), descriptor.handlerRef());
      queueClient.sendMessage(dlq, envelope.toJson(jsonCodec), Map.of());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to send message " + message.messageId() + " to DLQ " + deadLetter.queueName(), e);
      return;
    }
    metrics.incrementDeadLettered(descriptor.name());
    try {
      queueClient.deleteMessage(poller.queue(), message.receiptHandle());
      logger.info("Moved message " + message.messageId() + " to DLQ: " + deadLetter.queueName());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Sent message " + message.messageId() + " to DLQ but failed to delete it from "
          + descriptor.name(), e);
      metrics.incrementDeleteErrors(descriptor.name());
    }
  }

  static <T> List<List<T>> partition(List<T> items, int size) {
    if (size < 1) {
      throw new IllegalArgumentException("size must be >= 1");
    }
    List<List<T>> result = new ArrayList<>((items.size() + size - 1) / size);
    for (int i = 0; i < items.size(); i += size) {
      result.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
    }
    return result;
  }

  private static String messageOf(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
  }

  /**
   * Cancels every schedule and moves every loop to {@link LoopState#STOPPED}. In-flight
   * handlers finish or hit their deadline. Idempotent.
   */
  public synchronized void stopPolling() {
    boolean any = false;
    for (QueuePoller poller : pollers.values()) {
      PollerState state = poller.state();
      if (!state.transition(LoopState.POLLING, LoopState.STOPPING)) {
        continue;
      }
      any = true;
      poller.cancel();
      state.state(LoopState.STOPPED);
      logger.fine("Stopped poller: " + poller.pollerId());
    }
    if (any) {
      logger.info("Stopped all queue pollers");
    }
  }

  /**
   * @return a snapshot of every loop, keyed by poller id
   */
  public Map<String, PollerStatus> pollerStates() {
    Map<String, PollerStatus> result = new LinkedHashMap<>();
    pollers.forEach((id, poller) -> result.put(id, poller.snapshot()));
    return result;
  }

  /**
   * @return the loop state, {@link LoopState#STOPPED} for an unknown loop
   */
  public LoopState loopState(String queueName, String handlerRef) {
    QueuePoller poller = pollers.get(queueName + "-" + handlerRef);
    return poller == null ? LoopState.STOPPED : poller.state().state();
  }

  /**
   * @return {@code true} if at least one loop is polling
   */
  public boolean isPolling() {
    for (QueuePoller poller : pollers.values()) {
      if (poller.state().state() == LoopState.POLLING) {
        return true;
      }
    }
    return false;
  }

  /**
   * Stops polling and waits up to {@code drainTimeout} for running cycles to finish.
   * The invoker is not closed.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    stopPolling();
    closed = true;
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
    if (cyclePool != null) {
      cyclePool.shutdown();
      try {
        if (!cyclePool.awaitTermination(config.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
          logger.warning("Poll cycles still running after " + config.drainTimeout().toMillis() + "ms, interrupting");
          cyclePool.shutdownNow();
        }
      } catch (InterruptedException e) {
        cyclePool.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link DeliveryEngine}.
   */
  public static final class Builder {
    private QueueClient queueClient;
    private HandlerInvoker invoker;
    private QueueRegistry registry;
    private SqsOfflineConfig config;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder queueClient(QueueClient queueClient) {
      this.queueClient = queueClient;
      return this;
    }

    /**
     * Sets the invoker running handlers.
     *
     * <p><b>Required.</b>
     */
    public Builder invoker(HandlerInvoker invoker) {
      this.invoker = invoker;
      return this;
    }

    /**
     * Registry used to resolve queues and dead-letter queues; share it with the
     * {@link io.sqsoffline.provision.QueueProvisioner}.
     *
     * <p>Optional. Defaults to a new registry.
     */
    public Builder registry(QueueRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Supplies poll interval, region, drain timeout and the queues {@link #pollNow} can
     * run without a started loop.
     *
     * <p>Optional. Defaults to {@link SqsOfflineConfig#defaults()}.
     */
    public Builder config(SqsOfflineConfig config) {
      this.config = config;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Codec for dead-letter envelopes.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public DeliveryEngine build() {
      return new DeliveryEngine(this);
    }
  }
}
