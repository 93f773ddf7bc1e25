package io.sqsoffline.spi;

/**
 * Thrown when an operation targets a queue the backend does not know.
 */
public class QueueDoesNotExistException extends QueueOperationException {

  public QueueDoesNotExistException(Operation operation, String queueName) {
    super(operation, queueName, "Queue does not exist: " + queueName);
  }

  public QueueDoesNotExistException(Operation operation, String queueName, Throwable cause) {
    super(operation, queueName, "Queue does not exist: " + queueName, cause);
  }
}
