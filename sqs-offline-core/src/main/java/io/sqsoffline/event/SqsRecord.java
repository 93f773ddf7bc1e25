package io.sqsoffline.event;

import io.sqsoffline.model.MessageAttributeValue;

import java.util.Map;

/**
 * One message entry of an {@link SqsEvent}.
 *
 * @param messageId         backend message id
 * @param receiptHandle     delivery token
 * @param body              raw body
 * @param attributes        system attributes; always contains {@code ApproximateReceiveCount}
 * @param messageAttributes user-defined attributes
 * @param md5OfBody         MD5 hex digest of the body
 * @param eventSource       always {@value #EVENT_SOURCE}
 * @param eventSourceARN    ARN of the source queue
 * @param awsRegion         region of the source queue
 */
public record SqsRecord(
    String messageId,
    String receiptHandle,
    String body,
    Map<String, String> attributes,
    Map<String, MessageAttributeValue> messageAttributes,
    String md5OfBody,
    String eventSource,
    String eventSourceARN,
    String awsRegion
) {
  public static final String EVENT_SOURCE = "aws:sqs";

  public SqsRecord {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    messageAttributes = messageAttributes == null ? Map.of() : Map.copyOf(messageAttributes);
  }
}
