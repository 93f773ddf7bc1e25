package io.sqsoffline.delivery;

import io.sqsoffline.model.MessageAttributeValue;
import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class DeadLetterEnvelopeTest {

  @Test
  void writesOriginalMessageInWireShape() {
    QueueMessage message = new QueueMessage("m-1", "r-1", "{\"orderId\":7}",
        Map.of("ApproximateReceiveCount", "3"),
        Map.of("tenant", MessageAttributeValue.ofString("acme"),
            "blob", new MessageAttributeValue("Binary", null, "hi".getBytes(StandardCharsets.UTF_8), List.of(), List.of())),
        "abc");
    DeadLetterEnvelope envelope = new DeadLetterEnvelope(message, "boom",
        Instant.parse("2024-05-01T10:00:00Z"), "orders", "handlers.orders");

    Map<String, Object> json = JsonCodec.getDefault().parseObject(envelope.toJson(JsonCodec.getDefault()));

    assertEquals("boom", json.get("failureReason"));
    assertEquals("2024-05-01T10:00:00Z", json.get("failureTime"));
    assertEquals("orders", json.get("queueName"));
    assertEquals("handlers.orders", json.get("handler"));
    Map<?, ?> original = (Map<?, ?>) json.get("originalMessage");
    assertEquals("m-1", original.get("MessageId"));
    assertEquals("r-1", original.get("ReceiptHandle"));
    assertEquals("abc", original.get("MD5OfBody"));
    assertEquals("{\"orderId\":7}", original.get("Body"));
    assertEquals(Map.of("ApproximateReceiveCount", "3"), original.get("Attributes"));
    Map<?, ?> attributes = (Map<?, ?>) original.get("MessageAttributes");
    assertEquals(Map.of("DataType", "String", "StringValue", "acme"), attributes.get("tenant"));
    assertEquals(Map.of("DataType", "Binary", "BinaryValue", "aGk="), attributes.get("blob"));
  }

  @Test
  void omitsEmptyOptionalFields() {
    QueueMessage message = new QueueMessage("m-1", "r-1", "x", Map.of(), Map.of(), null);

    String json = new DeadLetterEnvelope(message, "boom", Instant.EPOCH, "orders", "handlers.orders")
        .toJson(JsonCodec.getDefault());

    Map<?, ?> original = (Map<?, ?>) JsonCodec.getDefault().parseObject(json).get("originalMessage");
    assertFalse(original.containsKey("MD5OfBody"));
    assertFalse(original.containsKey("MessageAttributes"));
  }
}
