package io.sqsoffline.delivery;

import io.sqsoffline.model.MessageAttributeValue;
import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.util.JsonCodec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Body of a message redriven to a dead-letter queue.
 *
 * <p>Serialized as {@code {originalMessage, failureReason, failureTime, queueName, handler}};
 * {@code originalMessage} keeps the backend's message shape ({@code MessageId},
 * {@code ReceiptHandle}, {@code MD5OfBody}, {@code Body}, {@code Attributes},
 * {@code MessageAttributes}).
 *
 * @param originalMessage the failed message
 * @param failureReason   why the last attempt failed
 * @param failureTime     when it failed
 * @param queueName       the source queue
 * @param handler         the handler reference
 */
public record DeadLetterEnvelope(
    QueueMessage originalMessage,
    String failureReason,
    Instant failureTime,
    String queueName,
    String handler
) {

  public DeadLetterEnvelope {
    Objects.requireNonNull(originalMessage, "originalMessage");
    Objects.requireNonNull(failureReason, "failureReason");
    Objects.requireNonNull(failureTime, "failureTime");
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(handler, "handler");
  }

  public String toJson(JsonCodec codec) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("originalMessage", messageMap(originalMessage));
    body.put("failureReason", failureReason);
    body.put("failureTime", failureTime.toString());
    body.put("queueName", queueName);
    body.put("handler", handler);
    return codec.toJson(body);
  }

  private static Map<String, Object> messageMap(QueueMessage message) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("MessageId", message.messageId());
    map.put("ReceiptHandle", message.receiptHandle());
    if (message.md5OfBody() != null) {
      map.put("MD5OfBody", message.md5OfBody());
    }
    map.put("Body", message.body());
    map.put("Attributes", message.attributes());
    if (!message.messageAttributes().isEmpty()) {
      Map<String, Object> attributes = new LinkedHashMap<>();
      message.messageAttributes().forEach((name, value) -> attributes.put(name, attributeMap(value)));
      map.put("MessageAttributes", attributes);
    }
    return map;
  }

  private static Map<String, Object> attributeMap(MessageAttributeValue value) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("DataType", value.dataType());
    if (value.stringValue() != null) {
      map.put("StringValue", value.stringValue());
    }
    if (value.binaryValue() != null) {
      map.put("BinaryValue", Base64.getEncoder().encodeToString(value.binaryValue()));
    }
    if (!value.stringListValues().isEmpty()) {
      map.put("StringListValues", value.stringListValues());
    }
    if (!value.binaryListValues().isEmpty()) {
      List<String> encoded = new ArrayList<>();
      for (byte[] bytes : value.binaryListValues()) {
        encoded.add(Base64.getEncoder().encodeToString(bytes));
      }
      map.put("BinaryListValues", encoded);
    }
    return map;
  }
}
