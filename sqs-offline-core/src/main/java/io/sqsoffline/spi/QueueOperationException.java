package io.sqsoffline.spi;

import java.util.Objects;

/**
 * Transport failure reported by a {@link QueueClient}.
 *
 * <p>Tagged with the {@link Operation} that failed and, when known, the queue involved.
 */
public class QueueOperationException extends RuntimeException {

  /**
   * Queue client operations.
   */
  public enum Operation {
    CREATE,
    GET_INFO,
    SET_ATTRIBUTES,
    RECEIVE,
    DELETE,
    SEND
  }

  private final Operation operation;
  private final String queueName;

  public QueueOperationException(Operation operation, String queueName, String message) {
    super(message);
    this.operation = Objects.requireNonNull(operation, "operation");
    this.queueName = queueName;
  }

  public QueueOperationException(Operation operation, String queueName, String message, Throwable cause) {
    super(message, cause);
    this.operation = Objects.requireNonNull(operation, "operation");
    this.queueName = queueName;
  }

  public Operation operation() {
    return operation;
  }

  /**
   * @return the queue the failed operation targeted, or {@code null} if unknown
   */
  public String queueName() {
    return queueName;
  }
}
