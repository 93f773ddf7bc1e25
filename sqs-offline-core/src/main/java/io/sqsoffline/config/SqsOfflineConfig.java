package io.sqsoffline.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Global configuration: defaults every {@link QueueDescriptor} inherits, plus the queues
 * themselves.
 *
 * <p>Create instances via {@link #builder()}. All values are validated at build time.
 *
 * <pre>{@code
 * SqsOfflineConfig config = SqsOfflineConfig.builder()
 *     .pollInterval(Duration.ofMillis(500))
 *     .queue(QueueDescriptor.builder("orders", "handlers.Orders.process")
 *         .deadLetterQueue(true))
 *     .build();
 * }</pre>
 */
public final class SqsOfflineConfig {
  public static final String DEFAULT_REGION = "us-east-1";
  public static final String DEFAULT_ACCOUNT_ID = "000000000000";
  public static final String DEFAULT_DEAD_LETTER_QUEUE_SUFFIX = "-dlq";
  public static final String DEFAULT_ACCESS_KEY_ID = "test";
  public static final String DEFAULT_SECRET_ACCESS_KEY = "test";

  static final long MIN_POLL_INTERVAL_MS = 100;
  static final int MAX_VISIBILITY_TIMEOUT_SECONDS = 43_200;
  static final int MAX_WAIT_TIME_SECONDS = 20;
  static final int MAX_BATCH_SIZE = 10;
  static final long MIN_HANDLER_TIMEOUT_MS = 1_000;
  static final long MAX_HANDLER_TIMEOUT_MS = 900_000;

  private static final SqsOfflineConfig DEFAULTS = builder().build();

  private final boolean enabled;
  private final String region;
  private final String accountId;
  private final String endpoint;
  private final String accessKeyId;
  private final String secretAccessKey;
  private final boolean autoCreate;
  private final Duration pollInterval;
  private final int maxConcurrentPolls;
  private final int visibilityTimeoutSeconds;
  private final int waitTimeSeconds;
  private final int maxReceiveCount;
  private final String deadLetterQueueSuffix;
  private final boolean skipCacheInvalidation;
  private final Duration handlerTimeout;
  private final int batchSize;
  private final Duration drainTimeout;
  private final List<QueueDescriptor> queues;

  private SqsOfflineConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.region = Objects.requireNonNull(builder.region, "region");
    this.accountId = Objects.requireNonNull(builder.accountId, "accountId");
    this.endpoint = builder.endpoint == null || builder.endpoint.isBlank() ? null : builder.endpoint;
    this.accessKeyId = Objects.requireNonNull(builder.accessKeyId, "accessKeyId");
    this.secretAccessKey = Objects.requireNonNull(builder.secretAccessKey, "secretAccessKey");
    this.autoCreate = builder.autoCreate;
    this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
    this.maxConcurrentPolls = builder.maxConcurrentPolls;
    this.visibilityTimeoutSeconds = builder.visibilityTimeoutSeconds;
    this.waitTimeSeconds = builder.waitTimeSeconds;
    this.maxReceiveCount = builder.maxReceiveCount;
    this.deadLetterQueueSuffix = Objects.requireNonNull(builder.deadLetterQueueSuffix, "deadLetterQueueSuffix");
    this.skipCacheInvalidation = builder.skipCacheInvalidation;
    this.handlerTimeout = Objects.requireNonNull(builder.handlerTimeout, "handlerTimeout");
    this.batchSize = builder.batchSize;
    this.drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");

    if (region.isBlank()) {
      throw new IllegalArgumentException("region must not be blank");
    }
    if (pollInterval.toMillis() < MIN_POLL_INTERVAL_MS) {
      throw new IllegalArgumentException("pollInterval must be >= " + MIN_POLL_INTERVAL_MS + "ms");
    }
    if (maxConcurrentPolls < 1) {
      throw new IllegalArgumentException("maxConcurrentPolls must be >= 1");
    }
    checkVisibilityTimeout(visibilityTimeoutSeconds);
    checkWaitTime(waitTimeSeconds);
    if (maxReceiveCount < 1) {
      throw new IllegalArgumentException("maxReceiveCount must be >= 1");
    }
    checkHandlerTimeout(handlerTimeout);
    checkBatchSize(batchSize);
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }

    List<QueueDescriptor> resolved = new ArrayList<>(builder.queues.size());
    Set<String> names = new HashSet<>();
    for (QueueDescriptor.Builder queue : builder.queues) {
      QueueDescriptor descriptor = queue.build(this);
      if (!names.add(descriptor.name())) {
        throw new IllegalArgumentException("Duplicate queue name: " + descriptor.name());
      }
      resolved.add(descriptor);
    }
    this.queues = List.copyOf(resolved);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a configuration with every default applied and no queues.
   *
   * @return the default configuration
   */
  public static SqsOfflineConfig defaults() {
    return DEFAULTS;
  }

  static void checkVisibilityTimeout(int seconds) {
    if (seconds < 0 || seconds > MAX_VISIBILITY_TIMEOUT_SECONDS) {
      throw new IllegalArgumentException("visibilityTimeoutSeconds must be in [0, " + MAX_VISIBILITY_TIMEOUT_SECONDS + "]");
    }
  }

  static void checkWaitTime(int seconds) {
    if (seconds < 0 || seconds > MAX_WAIT_TIME_SECONDS) {
      throw new IllegalArgumentException("waitTimeSeconds must be in [0, " + MAX_WAIT_TIME_SECONDS + "]");
    }
  }

  static void checkBatchSize(int batchSize) {
    if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
      throw new IllegalArgumentException("batchSize must be in [1, " + MAX_BATCH_SIZE + "]");
    }
  }

  static void checkHandlerTimeout(Duration timeout) {
    long ms = timeout.toMillis();
    if (ms < MIN_HANDLER_TIMEOUT_MS || ms > MAX_HANDLER_TIMEOUT_MS) {
      throw new IllegalArgumentException(
          "handlerTimeout must be in [" + MIN_HANDLER_TIMEOUT_MS + ", " + MAX_HANDLER_TIMEOUT_MS + "] ms");
    }
  }

  public boolean enabled() {
    return enabled;
  }

  public String region() {
    return region;
  }

  public String accountId() {
    return accountId;
  }

  /**
   * @return the queue service endpoint, e.g. {@code http://localhost:4566}, or {@code null}
   *     for the default endpoint of {@link #region()}
   */
  public String endpoint() {
    return endpoint;
  }

  public String accessKeyId() {
    return accessKeyId;
  }

  public String secretAccessKey() {
    return secretAccessKey;
  }

  public boolean autoCreate() {
    return autoCreate;
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public int maxConcurrentPolls() {
    return maxConcurrentPolls;
  }

  public int visibilityTimeoutSeconds() {
    return visibilityTimeoutSeconds;
  }

  public int waitTimeSeconds() {
    return waitTimeSeconds;
  }

  public int maxReceiveCount() {
    return maxReceiveCount;
  }

  public String deadLetterQueueSuffix() {
    return deadLetterQueueSuffix;
  }

  public boolean skipCacheInvalidation() {
    return skipCacheInvalidation;
  }

  public Duration handlerTimeout() {
    return handlerTimeout;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  /**
   * @return the configured queues, in declaration order
   */
  public List<QueueDescriptor> queues() {
    return queues;
  }

  /**
   * Builder for {@link SqsOfflineConfig}.
   */
  public static final class Builder {
    private boolean enabled = true;
    private String region = DEFAULT_REGION;
    private String accountId = DEFAULT_ACCOUNT_ID;
    private String endpoint;
    private String accessKeyId = DEFAULT_ACCESS_KEY_ID;
    private String secretAccessKey = DEFAULT_SECRET_ACCESS_KEY;
    private boolean autoCreate = true;
    private Duration pollInterval = Duration.ofMillis(1000);
    private int maxConcurrentPolls = 3;
    private int visibilityTimeoutSeconds = 30;
    private int waitTimeSeconds = 20;
    private int maxReceiveCount = 3;
    private String deadLetterQueueSuffix = DEFAULT_DEAD_LETTER_QUEUE_SUFFIX;
    private boolean skipCacheInvalidation;
    private Duration handlerTimeout = Duration.ofMillis(30_000);
    private int batchSize = 1;
    private Duration drainTimeout = Duration.ofSeconds(5);
    private final List<QueueDescriptor.Builder> queues = new ArrayList<>();

    private Builder() {
    }

    /**
     * Master switch. When disabled, {@link io.sqsoffline.SqsOffline#start()} does nothing.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Region reported in queue ARNs and event records.
     *
     * <p>Optional. Defaults to {@value SqsOfflineConfig#DEFAULT_REGION}.
     */
    public Builder region(String region) {
      this.region = region;
      return this;
    }

    /**
     * Account id used when building queue and function ARNs.
     *
     * <p>Optional. Defaults to {@value SqsOfflineConfig#DEFAULT_ACCOUNT_ID}.
     */
    public Builder accountId(String accountId) {
      this.accountId = accountId;
      return this;
    }

    /**
     * Endpoint of the queue service a network transport connects to, such as a local
     * emulator. Blank means the region's default endpoint. The embedded client ignores it.
     *
     * <p>Optional. Defaults to {@code null}.
     */
    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@value SqsOfflineConfig#DEFAULT_ACCESS_KEY_ID}.
     */
    public Builder accessKeyId(String accessKeyId) {
      this.accessKeyId = accessKeyId;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@value SqsOfflineConfig#DEFAULT_SECRET_ACCESS_KEY}.
     */
    public Builder secretAccessKey(String secretAccessKey) {
      this.secretAccessKey = secretAccessKey;
      return this;
    }

    /**
     * Whether queues and dead-letter queues are created at startup.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder autoCreate(boolean autoCreate) {
      this.autoCreate = autoCreate;
      return this;
    }

    /**
     * Interval between pulls of each polling loop.
     *
     * <p>Optional. Defaults to 1 second. Must be &ge; 100 ms.
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Default per-queue concurrency limit.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder maxConcurrentPolls(int maxConcurrentPolls) {
      this.maxConcurrentPolls = maxConcurrentPolls;
      return this;
    }

    /**
     * Default visibility timeout in seconds.
     *
     * <p>Optional. Defaults to {@code 30}. Must be in [0, 43200].
     */
    public Builder visibilityTimeoutSeconds(int visibilityTimeoutSeconds) {
      this.visibilityTimeoutSeconds = visibilityTimeoutSeconds;
      return this;
    }

    /**
     * Default long-poll wait in seconds.
     *
     * <p>Optional. Defaults to {@code 20}. Must be in [0, 20].
     */
    public Builder waitTimeSeconds(int waitTimeSeconds) {
      this.waitTimeSeconds = waitTimeSeconds;
      return this;
    }

    /**
     * Default delivery-attempt threshold for redrive.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder maxReceiveCount(int maxReceiveCount) {
      this.maxReceiveCount = maxReceiveCount;
      return this;
    }

    /**
     * Suffix appended to a queue name to derive its dead-letter queue name.
     *
     * <p>Optional. Defaults to {@value SqsOfflineConfig#DEFAULT_DEAD_LETTER_QUEUE_SUFFIX}.
     */
    public Builder deadLetterQueueSuffix(String deadLetterQueueSuffix) {
      this.deadLetterQueueSuffix = deadLetterQueueSuffix;
      return this;
    }

    /**
     * When {@code true}, handlers are loaded once and reused instead of being reloaded
     * before every invocation.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder skipCacheInvalidation(boolean skipCacheInvalidation) {
      this.skipCacheInvalidation = skipCacheInvalidation;
      return this;
    }

    /**
     * Default handler deadline.
     *
     * <p>Optional. Defaults to 30 seconds. Must be in [1 s, 900 s].
     */
    public Builder handlerTimeout(Duration handlerTimeout) {
      this.handlerTimeout = handlerTimeout;
      return this;
    }

    /**
     * Default number of messages requested per pull.
     *
     * <p>Optional. Defaults to {@code 1}. Must be in [1, 10].
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * How long {@code close()} waits for running cycles and handlers to finish.
     *
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Adds a queue. Unset queue fields inherit this configuration's defaults.
     *
     * @param queue the queue builder
     * @return this builder
     */
    public Builder queue(QueueDescriptor.Builder queue) {
      queues.add(Objects.requireNonNull(queue, "queue"));
      return this;
    }

    /**
     * Adds several queues.
     *
     * @param queues the queue builders
     * @return this builder
     */
    public Builder queues(List<QueueDescriptor.Builder> queues) {
      for (QueueDescriptor.Builder queue : queues) {
        queue(queue);
      }
      return this;
    }

    /**
     * Builds the configuration and resolves every queue against it.
     *
     * @return a new {@link SqsOfflineConfig}
     * @throws NullPointerException     if a required value is null
     * @throws IllegalArgumentException if a value is out of range or a queue name repeats
     */
    public SqsOfflineConfig build() {
      return new SqsOfflineConfig(this);
    }
  }
}
