package io.sqsoffline.config;

import io.sqsoffline.util.QueueArns;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Derives queue descriptors from a function definition map.
 *
 * <p>The expected shape mirrors a serverless service definition:
 * <pre>
 * {
 *   "processOrder": {
 *     "handler": "handlers.Orders.process",
 *     "events": [
 *       { "sqs": "arn:aws:sqs:us-east-1:000000000000:orders" },
 *       { "sqs": { "queueName": "audit", "batchSize": 5 } }
 *     ]
 *   }
 * }
 * </pre>
 *
 * <p>An {@code sqs} event is either an ARN string (queue name = last {@code ':'} segment) or
 * an object with {@code arn} or {@code queueName} and an optional {@code batchSize}.
 * Malformed entries are skipped with a warning.
 */
public final class FunctionEventSources {
  private static final Logger logger = Logger.getLogger(FunctionEventSources.class.getName());

  private FunctionEventSources() {}

  /**
   * Extracts one queue builder per {@code sqs} event.
   *
   * @param functions function name to function definition
   * @return queue builders in declaration order
   */
  public static List<QueueDescriptor.Builder> extract(Map<String, ?> functions) {
    List<QueueDescriptor.Builder> result = new ArrayList<>();
    if (functions == null) {
      return result;
    }
    for (Map.Entry<String, ?> entry : functions.entrySet()) {
      String functionName = entry.getKey();
      if (!(entry.getValue() instanceof Map<?, ?> definition)) {
        continue;
      }
      Object handler = definition.get("handler");
      Object events = definition.get("events");
      if (!(events instanceof List<?> eventList)) {
        continue;
      }
      if (!(handler instanceof String handlerRef) || handlerRef.isBlank()) {
        logger.warning("Function " + functionName + " declares SQS events but no handler; skipping");
        continue;
      }
      for (Object event : eventList) {
        if (event instanceof Map<?, ?> eventMap && eventMap.containsKey("sqs")) {
          QueueDescriptor.Builder queue = parseSqsEvent(functionName, handlerRef, eventMap.get("sqs"));
          if (queue != null) {
            result.add(queue);
          }
        }
      }
    }
    logger.fine("Extracted " + result.size() + " queue configurations from functions");
    return result;
  }

  private static QueueDescriptor.Builder parseSqsEvent(String functionName, String handlerRef, Object sqsEvent) {
    if (sqsEvent instanceof String arn) {
      return QueueDescriptor.builder(QueueArns.resourceName(arn), handlerRef);
    }
    if (!(sqsEvent instanceof Map<?, ?> event)) {
      logger.warning("Unsupported SQS event format for function " + functionName);
      return null;
    }
    String queueName;
    if (event.get("arn") instanceof String arn) {
      queueName = QueueArns.resourceName(arn);
    } else if (event.get("queueName") instanceof String name) {
      queueName = name;
    } else {
      logger.warning("Invalid SQS event configuration for function " + functionName);
      return null;
    }
    QueueDescriptor.Builder queue = QueueDescriptor.builder(queueName, handlerRef);
    Object batchSize = event.get("batchSize");
    if (batchSize instanceof Number n) {
      queue.batchSize(n.intValue());
    } else if (batchSize != null) {
      logger.warning("Ignoring non-numeric batchSize for function " + functionName + ": " + batchSize);
    }
    return queue;
  }
}
