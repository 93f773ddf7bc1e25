package io.sqsoffline.config;

import java.util.Objects;

/**
 * Resolved dead-letter policy of a queue.
 *
 * @param enabled             whether messages past the threshold are redriven
 * @param maxDeliveryAttempts delivery attempt at or after which a failed message is redriven
 * @param queueName           name of the dead-letter queue
 */
public record DeadLetterPolicy(boolean enabled, int maxDeliveryAttempts, String queueName) {

  public DeadLetterPolicy {
    Objects.requireNonNull(queueName, "queueName");
    if (maxDeliveryAttempts < 1) {
      throw new IllegalArgumentException("maxDeliveryAttempts must be >= 1");
    }
  }
}
