package io.sqsoffline.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A message received from a queue.
 *
 * <p>{@code attributes} holds backend-assigned system attributes (for example
 * {@value #APPROXIMATE_RECEIVE_COUNT}); {@code messageAttributes} holds user-defined ones.
 *
 * @param messageId         backend message id
 * @param receiptHandle     opaque token required to delete this delivery
 * @param body              message body
 * @param attributes        system attributes (never {@code null})
 * @param messageAttributes user attributes (never {@code null})
 * @param md5OfBody         MD5 digest of the body as reported by the backend, or {@code null}
 */
public record QueueMessage(
    String messageId,
    String receiptHandle,
    String body,
    Map<String, String> attributes,
    Map<String, MessageAttributeValue> messageAttributes,
    String md5OfBody
) {
  public static final String APPROXIMATE_RECEIVE_COUNT = "ApproximateReceiveCount";
  public static final String SENT_TIMESTAMP = "SentTimestamp";
  public static final String SENDER_ID = "SenderId";
  public static final String APPROXIMATE_FIRST_RECEIVE_TIMESTAMP = "ApproximateFirstReceiveTimestamp";

  public QueueMessage {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(receiptHandle, "receiptHandle");
    body = body == null ? "" : body;
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    messageAttributes = messageAttributes == null ? Map.of() : Map.copyOf(messageAttributes);
  }

  /**
   * Returns how many times this message has been delivered, including this delivery.
   *
   * @return the parsed receive count, or {@code 1} when missing or malformed
   */
  public int deliveryAttemptCount() {
    String raw = attributes.get(APPROXIMATE_RECEIVE_COUNT);
    if (raw == null) {
      return 1;
    }
    try {
      int count = Integer.parseInt(raw.trim());
      return count < 1 ? 1 : count;
    } catch (NumberFormatException e) {
      return 1;
    }
  }

  /**
   * Returns the time the message was sent, if the backend reported it.
   *
   * @return the send time, or {@code null} when missing or malformed
   */
  public Instant sentAt() {
    String raw = attributes.get(SENT_TIMESTAMP);
    if (raw == null) {
      return null;
    }
    try {
      return Instant.ofEpochMilli(Long.parseLong(raw.trim()));
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
