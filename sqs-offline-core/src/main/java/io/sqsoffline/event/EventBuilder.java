package io.sqsoffline.event;

import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.util.QueueArns;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link SqsEvent}s from received messages.
 *
 * <p>System attributes are filled with defaults first and then overlaid with whatever the
 * backend reported, so {@code ApproximateReceiveCount}, {@code SentTimestamp},
 * {@code SenderId} and {@code ApproximateFirstReceiveTimestamp} are always present.
 */
public final class EventBuilder {
  static final String DEFAULT_SENDER_ID = "AIDAIENQZJOLO23YVJ4VO";

  private final String region;
  private final String accountId;
  private final Clock clock;

  public EventBuilder(String region, String accountId) {
    this(region, accountId, Clock.systemUTC());
  }

  EventBuilder(String region, String accountId, Clock clock) {
    this.region = Objects.requireNonNull(region, "region");
    this.accountId = Objects.requireNonNull(accountId, "accountId");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds an event with one record per message.
   *
   * @param queueName source queue
   * @param messages  received messages
   * @return the event
   */
  public SqsEvent buildEvent(String queueName, List<QueueMessage> messages) {
    return new SqsEvent(messages.stream().map(m -> buildRecord(queueName, m)).toList());
  }

  public SqsEvent buildEvent(String queueName, QueueMessage message) {
    return SqsEvent.of(buildRecord(queueName, message));
  }

  public SqsRecord buildRecord(String queueName, QueueMessage message) {
    String now = Long.toString(clock.millis());
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put(QueueMessage.APPROXIMATE_RECEIVE_COUNT, "1");
    attributes.put(QueueMessage.SENT_TIMESTAMP, now);
    attributes.put(QueueMessage.SENDER_ID, DEFAULT_SENDER_ID);
    attributes.put(QueueMessage.APPROXIMATE_FIRST_RECEIVE_TIMESTAMP, now);
    attributes.putAll(message.attributes());

    String md5 = message.md5OfBody() != null ? message.md5OfBody() : md5Hex(message.body());
    return new SqsRecord(
        message.messageId(),
        message.receiptHandle(),
        message.body(),
        attributes,
        message.messageAttributes(),
        md5,
        SqsRecord.EVENT_SOURCE,
        QueueArns.queueArn(region, accountId, queueName),
        region);
  }

  /**
   * Returns the lower-case hex MD5 digest of the UTF-8 bytes of {@code body}.
   *
   * @param body the message body
   * @return the digest
   */
  public static String md5Hex(String body) {
    try {
      MessageDigest digest = MessageDigest.getInstance("MD5");
      return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }
}
