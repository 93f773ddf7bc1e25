package io.sqsoffline.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Identity and delivery policy of one polled queue.
 *
 * <p>Immutable. Built from a {@link Builder} resolved against a {@link SqsOfflineConfig}:
 * every field left unset on the builder takes the configuration's default.
 */
public final class QueueDescriptor {
  private final String name;
  private final String handlerRef;
  private final boolean enabled;
  private final int batchSize;
  private final int concurrencyLimit;
  private final int visibilityTimeoutSeconds;
  private final int longPollWaitSeconds;
  private final Duration handlerTimeout;
  private final DeadLetterPolicy deadLetterPolicy;

  private QueueDescriptor(Builder builder, SqsOfflineConfig defaults) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.handlerRef = Objects.requireNonNull(builder.handlerRef, "handlerRef");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (handlerRef.isBlank()) {
      throw new IllegalArgumentException("handlerRef must not be blank");
    }
    this.enabled = builder.enabled;
    this.batchSize = builder.batchSize != null ? builder.batchSize : defaults.batchSize();
    this.concurrencyLimit = builder.concurrencyLimit != null ? builder.concurrencyLimit : defaults.maxConcurrentPolls();
    this.visibilityTimeoutSeconds = builder.visibilityTimeoutSeconds != null
        ? builder.visibilityTimeoutSeconds : defaults.visibilityTimeoutSeconds();
    this.longPollWaitSeconds = builder.longPollWaitSeconds != null
        ? builder.longPollWaitSeconds : defaults.waitTimeSeconds();
    this.handlerTimeout = builder.handlerTimeout != null ? builder.handlerTimeout : defaults.handlerTimeout();

    SqsOfflineConfig.checkBatchSize(batchSize);
    if (concurrencyLimit < 1) {
      throw new IllegalArgumentException("concurrencyLimit must be >= 1");
    }
    SqsOfflineConfig.checkVisibilityTimeout(visibilityTimeoutSeconds);
    SqsOfflineConfig.checkWaitTime(longPollWaitSeconds);
    SqsOfflineConfig.checkHandlerTimeout(handlerTimeout);

    int maxAttempts = builder.maxDeliveryAttempts != null ? builder.maxDeliveryAttempts : defaults.maxReceiveCount();
    String dlqName = builder.deadLetterQueueName != null
        ? builder.deadLetterQueueName : name + defaults.deadLetterQueueSuffix();
    this.deadLetterPolicy = new DeadLetterPolicy(builder.deadLetterEnabled, maxAttempts, dlqName);
  }

  /**
   * Starts a builder for the given queue and handler.
   *
   * @param name       queue name
   * @param handlerRef handler reference, {@code <module>.<export>}
   * @return a new builder
   */
  public static Builder builder(String name, String handlerRef) {
    return new Builder(name, handlerRef);
  }

  public String name() {
    return name;
  }

  public String handlerRef() {
    return handlerRef;
  }

  public boolean enabled() {
    return enabled;
  }

  public int batchSize() {
    return batchSize;
  }

  /**
   * @return the maximum number of handler executions running at once for this queue
   */
  public int concurrencyLimit() {
    return concurrencyLimit;
  }

  public int visibilityTimeoutSeconds() {
    return visibilityTimeoutSeconds;
  }

  public int longPollWaitSeconds() {
    return longPollWaitSeconds;
  }

  public Duration handlerTimeout() {
    return handlerTimeout;
  }

  /**
   * @return the delivery attempt at or after which a failed message is redriven (or abandoned
   *     to natural redelivery when no dead-letter queue is enabled)
   */
  public int maxDeliveryAttempts() {
    return deadLetterPolicy.maxDeliveryAttempts();
  }

  public DeadLetterPolicy deadLetterPolicy() {
    return deadLetterPolicy;
  }

  /**
   * @return {@code <name>-<handlerRef>}, the key of this queue's polling loop
   */
  public String pollerId() {
    return name + "-" + handlerRef;
  }

  @Override
  public String toString() {
    return "QueueDescriptor{name=" + name + ", handlerRef=" + handlerRef + ", enabled=" + enabled
        + ", batchSize=" + batchSize + ", concurrencyLimit=" + concurrencyLimit
        + ", deadLetter=" + deadLetterPolicy + "}";
  }

  /**
   * Builder for {@link QueueDescriptor}. Fields left unset inherit the defaults of the
   * {@link SqsOfflineConfig} the builder is resolved against.
   */
  public static final class Builder {
    private final String name;
    private final String handlerRef;
    private boolean enabled = true;
    private Integer batchSize;
    private Integer concurrencyLimit;
    private Integer visibilityTimeoutSeconds;
    private Integer longPollWaitSeconds;
    private Duration handlerTimeout;
    private Integer maxDeliveryAttempts;
    private boolean deadLetterEnabled;
    private String deadLetterQueueName;

    private Builder(String name, String handlerRef) {
      this.name = name;
      this.handlerRef = handlerRef;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Messages requested per pull, in [1, 10].
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Upper bound on concurrent handler executions for this queue.
     */
    public Builder concurrencyLimit(int concurrencyLimit) {
      this.concurrencyLimit = concurrencyLimit;
      return this;
    }

    public Builder visibilityTimeoutSeconds(int visibilityTimeoutSeconds) {
      this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
      return this;
    }

    public Builder longPollWaitSeconds(int longPollWaitSeconds) {
      this.longPollWaitSeconds = longPollWaitSeconds;
      return this;
    }

    /**
     * Overrides the global handler deadline for this queue.
     */
    public Builder handlerTimeout(Duration handlerTimeout) {
      this.handlerTimeout = handlerTimeout;
      return this;
    }

    /**
     * Delivery-attempt threshold. Defaults to the global {@code maxReceiveCount}.
     */
    public Builder maxDeliveryAttempts(int maxDeliveryAttempts) {
      this.maxDeliveryAttempts = maxDeliveryAttempts;
      return this;
    }

    /**
     * Enables or disables the dead-letter queue. Disabled by default.
     */
    public Builder deadLetterQueue(boolean enabled) {
      this.deadLetterEnabled = enabled;
      return this;
    }

    /**
     * Explicit dead-letter queue name. Defaults to {@code <name><deadLetterQueueSuffix>}.
     */
    public Builder deadLetterQueueName(String deadLetterQueueName) {
      this.deadLetterQueueName = deadLetterQueueName;
      return this;
    }

    /**
     * Resolves against {@link SqsOfflineConfig#defaults()}.
     *
     * @return the descriptor
     */
    public QueueDescriptor build() {
      return build(SqsOfflineConfig.defaults());
    }

    /**
     * Resolves unset fields against the given configuration.
     *
     * @param defaults the configuration providing defaults
     * @return the descriptor
     * @throws NullPointerException     if {@code name} or {@code handlerRef} is null
     * @throws IllegalArgumentException if a value is out of range
     */
    public QueueDescriptor build(SqsOfflineConfig defaults) {
      return new QueueDescriptor(this, Objects.requireNonNull(defaults, "defaults"));
    }
  }
}
