package io.sqsoffline;

import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.delivery.DeliveryEngine;
import io.sqsoffline.delivery.PollerStatus;
import io.sqsoffline.invoke.HandlerInvoker;
import io.sqsoffline.invoke.HandlerLoader;
import io.sqsoffline.provision.ProvisioningFailure;
import io.sqsoffline.provision.ProvisioningReport;
import io.sqsoffline.provision.QueueProvisioner;
import io.sqsoffline.provision.QueueRegistry;
import io.sqsoffline.spi.MetricsExporter;
import io.sqsoffline.spi.QueueClient;
import io.sqsoffline.util.JsonCodec;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link QueueProvisioner}, {@link HandlerInvoker} and
 * {@link DeliveryEngine} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultHandlerRegistry handlers = new DefaultHandlerRegistry()
 *     .register("orders.process", (event, context) -> null);
 *
 * try (SqsOffline sqs = SqsOffline.builder()
 *     .queueClient(new InMemoryQueueClient())
 *     .handlerLoader(handlers)
 *     .config(SqsOfflineConfig.builder()
 *         .queue(QueueDescriptor.builder("orders", "orders.process").deadLetterQueue(true))
 *         .build())
 *     .build()) {
 *   sqs.start();
 *   // ...
 * }
 * }</pre>
 *
 * @see QueueProvisioner
 * @see DeliveryEngine
 */
public final class SqsOffline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SqsOffline.class.getName());

  private final SqsOfflineConfig config;
  private final QueueRegistry registry;
  private final QueueProvisioner provisioner;
  private final HandlerInvoker invoker;
  private final DeliveryEngine engine;
  private final MetricsExporter metrics;
  private final Map<String, ?> resources;

  private boolean started;
  private boolean closed;

  private SqsOffline(Builder builder) {
    QueueClient queueClient = Objects.requireNonNull(builder.queueClient, "queueClient");
    HandlerLoader handlerLoader = Objects.requireNonNull(builder.handlerLoader, "handlerLoader");
    this.config = builder.config != null ? builder.config : SqsOfflineConfig.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.resources = builder.resources != null ? builder.resources : Map.of();
    JsonCodec jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();

    this.registry = new QueueRegistry();
    this.provisioner = QueueProvisioner.builder()
        .queueClient(queueClient)
        .registry(registry)
        .config(config)
        .jsonCodec(jsonCodec)
        .build();
    this.invoker = HandlerInvoker.builder()
        .loader(handlerLoader)
        .config(config)
        .executor(builder.handlerExecutor)
        .build();
    this.engine = DeliveryEngine.builder()
        .queueClient(queueClient)
        .invoker(invoker)
        .registry(registry)
        .config(config)
        .metrics(metrics)
        .jsonCodec(jsonCodec)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Provisions queues (resource definitions first, then configured queues) and starts
   * polling every enabled queue. Does nothing when the configuration is disabled or the
   * instance is already started.
   *
   * @return the provisioning report; empty when nothing was provisioned
   * @throws IllegalStateException if closed
   */
  public synchronized ProvisioningReport start() {
    if (closed) {
      throw new IllegalStateException("SqsOffline has been closed");
    }
    if (!config.enabled()) {
      logger.info("sqs-offline is disabled");
      return ProvisioningReport.empty();
    }
    if (started) {
      return ProvisioningReport.empty();
    }
    ProvisioningReport report = provisioner.provisionResources(resources)
        .merge(provisioner.ensureQueues(config.queues()));
    for (ProvisioningFailure failure : report.failures()) {
      logger.warning("Queue " + failure.queueName() + " was not provisioned: " + failure.message());
    }
    engine.startPolling(config.queues());
    started = true;
    logger.info("sqs-offline started with " + config.queues().size() + " queue(s)");
    return report;
  }

  /**
   * Stops every polling loop. Idempotent.
   */
  public synchronized void stop() {
    engine.stopPolling();
    started = false;
  }

  /**
   * Stops and restarts polling without provisioning again.
   */
  public synchronized void restart() {
    if (closed) {
      throw new IllegalStateException("SqsOffline has been closed");
    }
    logger.info("Restarting queue pollers");
    engine.stopPolling();
    if (config.enabled()) {
      engine.startPolling(config.queues());
      started = true;
    }
  }

  public Map<String, PollerStatus> pollerStates() {
    return engine.pollerStates();
  }

  public boolean isPolling() {
    return engine.isPolling();
  }

  public SqsOfflineConfig config() {
    return config;
  }

  public QueueRegistry registry() {
    return registry;
  }

  public QueueProvisioner provisioner() {
    return provisioner;
  }

  public HandlerInvoker invoker() {
    return invoker;
  }

  public DeliveryEngine engine() {
    return engine;
  }

  /**
   * Shuts down in order: delivery engine, invoker, metrics (if closeable).
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    started = false;
    RuntimeException first = null;
    try {
      engine.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      invoker.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      logger.log(Level.SEVERE, "Failed to close sqs-offline cleanly", first);
      throw first;
    }
  }

  /**
   * Builder for {@link SqsOffline}. Single use.
   */
  public static final class Builder {
    private QueueClient queueClient;
    private HandlerLoader handlerLoader;
    private SqsOfflineConfig config;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private ExecutorService handlerExecutor;
    private Map<String, ?> resources;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the queue backend.
     *
     * <p><b>Required.</b>
     */
    public Builder queueClient(QueueClient queueClient) {
      this.queueClient = queueClient;
      return this;
    }

    /**
     * Sets the loader resolving handler references.
     *
     * <p><b>Required.</b>
     */
    public Builder handlerLoader(HandlerLoader handlerLoader) {
      this.handlerLoader = handlerLoader;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link SqsOfflineConfig#defaults()}, which has no queues.
     */
    public Builder config(SqsOfflineConfig config) {
      this.config = config;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with this instance when it
     * implements {@link AutoCloseable}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Executor running handlers. Not shut down on close.
     *
     * <p>Optional. Defaults to an owned cached daemon pool.
     */
    public Builder handlerExecutor(ExecutorService handlerExecutor) {
      this.handlerExecutor = handlerExecutor;
      return this;
    }

    /**
     * Infrastructure resource definitions whose queues are provisioned on {@link #start()}.
     *
     * <p>Optional.
     *
     * @param resources logical id to {@code {Type, Properties}}
     * @return this builder
     */
    public Builder resources(Map<String, ?> resources) {
      this.resources = resources;
      return this;
    }

    /**
     * @return a new {@link SqsOffline}
     * @throws IllegalStateException if build() was already called
     * @throws NullPointerException  if {@code queueClient} or {@code handlerLoader} is null
     */
    public SqsOffline build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new SqsOffline(this);
    }
  }
}
