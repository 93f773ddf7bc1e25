package io.sqsoffline.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.sqsoffline.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers meters with a {@link MeterRegistry} for export to Prometheus, Grafana,
 * Datadog, and other monitoring backends. Every meter carries a {@value #QUEUE_TAG} tag
 * and is registered the first time its queue reports.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code sqs.offline.messages.received}: messages pulled from the queue</li>
 *   <li>{@code sqs.offline.handler.success}: invocations that succeeded</li>
 *   <li>{@code sqs.offline.handler.failure}: invocations that failed, timeouts included</li>
 *   <li>{@code sqs.offline.handler.timeout}: invocations that hit their deadline</li>
 *   <li>{@code sqs.offline.dead.lettered}: messages moved to the dead-letter queue</li>
 *   <li>{@code sqs.offline.receive.errors}: failed receive calls</li>
 *   <li>{@code sqs.offline.delete.errors}: failed deletes</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code sqs.offline.handler.duration}: handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_NAME_PREFIX = "sqs.offline";
  public static final String QUEUE_TAG = "queue";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Meter> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@value #DEFAULT_NAME_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_NAME_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "local.sqs"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementMessagesReceived(String queueName, int count) {
    if (closed) return;
    counter("messages.received", "Messages pulled from the queue", queueName).increment(count);
  }

  @Override
  public void incrementHandlerSuccess(String queueName) {
    if (closed) return;
    counter("handler.success", "Handler invocations that succeeded", queueName).increment();
  }

  @Override
  public void incrementHandlerFailure(String queueName) {
    if (closed) return;
    counter("handler.failure", "Handler invocations that failed", queueName).increment();
  }

  @Override
  public void incrementHandlerTimeout(String queueName) {
    if (closed) return;
    counter("handler.timeout", "Handler invocations that hit their deadline", queueName).increment();
  }

  @Override
  public void incrementDeadLettered(String queueName) {
    if (closed) return;
    counter("dead.lettered", "Messages moved to the dead-letter queue", queueName).increment();
  }

  @Override
  public void incrementReceiveErrors(String queueName) {
    if (closed) return;
    counter("receive.errors", "Failed receive calls", queueName).increment();
  }

  @Override
  public void incrementDeleteErrors(String queueName) {
    if (closed) return;
    counter("delete.errors", "Failed deletes", queueName).increment();
  }

  @Override
  public void recordHandlerDurationMs(String queueName, long durationMs) {
    if (closed) return;
    Timer timer = (Timer) meters.computeIfAbsent(key("handler.duration", queueName),
        k -> Timer.builder(namePrefix + ".handler.duration")
            .description("Handler execution time")
            .tag(QUEUE_TAG, queueName)
            .register(registry));
    timer.record(durationMs, TimeUnit.MILLISECONDS);
  }

  private Counter counter(String suffix, String description, String queueName) {
    return (Counter) meters.computeIfAbsent(key(suffix, queueName),
        k -> Counter.builder(namePrefix + "." + suffix)
            .description(description)
            .tag(QUEUE_TAG, queueName)
            .register(registry));
  }

  private static String key(String suffix, String queueName) {
    return suffix + "|" + queueName;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link io.sqsoffline.SqsOffline} instance is closed) to prevent stale meters.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : new ArrayList<>(meters.values())) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    if (first != null) throw first;
  }

  List<Meter> registeredMeters() {
    return List.copyOf(meters.values());
  }
}
