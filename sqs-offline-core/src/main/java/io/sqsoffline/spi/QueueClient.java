package io.sqsoffline.spi;

import io.sqsoffline.model.MessageAttributeValue;
import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.model.QueueMessage;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Transport abstraction over the queue backend.
 *
 * <p>All methods may throw {@link QueueOperationException}. Implementations must be
 * thread-safe: the delivery engine calls them concurrently from several polling loops.
 *
 * @see io.sqsoffline.client.InMemoryQueueClient
 */
public interface QueueClient {

  /**
   * Creates a queue, or returns the existing one if it has identical attributes.
   *
   * @param name       queue name
   * @param attributes queue attributes
   * @return the handle of the created queue
   * @throws QueueAlreadyExistsException if the queue exists with different attributes
   */
  QueueHandle createQueue(String name, Map<String, String> attributes);

  /**
   * Looks up an existing queue.
   *
   * @param name queue name
   * @return the queue handle, including its current attributes
   * @throws QueueDoesNotExistException if no such queue exists
   */
  QueueHandle getQueueInfo(String name);

  /**
   * Merges attributes into an existing queue.
   *
   * @param queue      the queue
   * @param attributes attributes to set
   */
  void setQueueAttributes(QueueHandle queue, Map<String, String> attributes);

  /**
   * Receives up to {@code maxMessages} messages. Received messages become invisible for
   * {@code visibilityTimeoutSeconds} and their receive count is incremented.
   *
   * @param queue                    the queue
   * @param maxMessages              1..10
   * @param visibilityTimeoutSeconds visibility timeout applied to received messages
   * @param waitTimeSeconds          long-poll wait when no message is available
   * @return received messages, possibly empty (never {@code null})
   */
  List<QueueMessage> receiveMessages(QueueHandle queue, int maxMessages, int visibilityTimeoutSeconds,
                                     int waitTimeSeconds);

  /**
   * Deletes one delivery.
   *
   * @param queue         the queue
   * @param receiptHandle receipt handle of the delivery
   */
  void deleteMessage(QueueHandle queue, String receiptHandle);

  /**
   * Deletes several deliveries. The default implementation deletes one by one.
   *
   * @param queue          the queue
   * @param receiptHandles receipt handles
   */
  default void deleteMessages(QueueHandle queue, Collection<String> receiptHandles) {
    for (String receiptHandle : receiptHandles) {
      deleteMessage(queue, receiptHandle);
    }
  }

  /**
   * Sends a message.
   *
   * @param queue             the queue
   * @param body              message body
   * @param messageAttributes user attributes, may be empty
   * @return the new message id
   */
  String sendMessage(QueueHandle queue, String body, Map<String, MessageAttributeValue> messageAttributes);
}
