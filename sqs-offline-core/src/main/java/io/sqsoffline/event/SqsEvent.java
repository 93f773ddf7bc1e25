package io.sqsoffline.event;

import java.util.List;

/**
 * Invocation event handed to a queue handler.
 *
 * <p>The delivery engine always builds single-record events: one event per received message.
 *
 * @param records the records, in receive order
 */
public record SqsEvent(List<SqsRecord> records) {

  public SqsEvent {
    records = records == null ? List.of() : List.copyOf(records);
  }

  public static SqsEvent of(SqsRecord record) {
    return new SqsEvent(List.of(record));
  }
}
