package io.sqsoffline.spi;

/**
 * Observability hook for exporting delivery counters to a metrics backend.
 *
 * <p>Every method receives the queue name so implementations can tag per queue. The
 * {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of messages received from a queue.
   *
   * @param queueName the queue
   * @param count     messages received in one pull
   */
  void incrementMessagesReceived(String queueName, int count);

  /**
   * Increments the count of handler invocations that succeeded (message deleted).
   */
  void incrementHandlerSuccess(String queueName);

  /**
   * Increments the count of handler invocations that failed, timeouts included.
   */
  void incrementHandlerFailure(String queueName);

  /**
   * Increments the count of handler invocations that hit their deadline.
   */
  default void incrementHandlerTimeout(String queueName) {
  }

  /**
   * Increments the count of messages redriven to a dead-letter queue.
   */
  void incrementDeadLettered(String queueName);

  /**
   * Increments the count of failed receive calls.
   */
  void incrementReceiveErrors(String queueName);

  /**
   * Increments the count of failed deletes after a successful invocation.
   */
  default void incrementDeleteErrors(String queueName) {
  }

  /**
   * Records the time spent executing a handler.
   *
   * @param queueName  the queue
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(String queueName, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementMessagesReceived(String queueName, int count) {
    }

    @Override
    public void incrementHandlerSuccess(String queueName) {
    }

    @Override
    public void incrementHandlerFailure(String queueName) {
    }

    @Override
    public void incrementDeadLettered(String queueName) {
    }

    @Override
    public void incrementReceiveErrors(String queueName) {
    }
  }
}
