package io.sqsoffline.spi;

/**
 * Thrown by {@link QueueClient#createQueue} when a queue with the same name already exists
 * with different attributes.
 */
public class QueueAlreadyExistsException extends QueueOperationException {

  public QueueAlreadyExistsException(String queueName) {
    super(Operation.CREATE, queueName, "Queue already exists: " + queueName);
  }

  public QueueAlreadyExistsException(String queueName, Throwable cause) {
    super(Operation.CREATE, queueName, "Queue already exists: " + queueName, cause);
  }
}
