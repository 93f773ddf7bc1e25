package io.sqsoffline.client;

import com.github.f4b6a3.ulid.UlidCreator;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.event.EventBuilder;
import io.sqsoffline.model.MessageAttributeValue;
import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.spi.QueueAlreadyExistsException;
import io.sqsoffline.spi.QueueClient;
import io.sqsoffline.spi.QueueDoesNotExistException;
import io.sqsoffline.spi.QueueOperationException;
import io.sqsoffline.spi.QueueOperationException.Operation;
import io.sqsoffline.util.QueueArns;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe in-process {@link QueueClient} for tests and demos.
 *
 * <p>Emulates the parts of the backend the delivery engine relies on: visibility leases,
 * a receive count incremented on every receive, long polling, and a fresh receipt handle
 * per delivery. Message ids and receipt handles are ULIDs. Redrive policies, retention and
 * FIFO ordering are not enforced.
 */
public final class InMemoryQueueClient implements QueueClient {
  static final long MAX_WAIT_SLICE_MS = 50;

  private final String region;
  private final String accountId;
  private final Clock clock;
  private final Map<String, StoredQueue> queues = new ConcurrentHashMap<>();

  public InMemoryQueueClient() {
    this(SqsOfflineConfig.DEFAULT_REGION, SqsOfflineConfig.DEFAULT_ACCOUNT_ID, Clock.systemUTC());
  }

  public InMemoryQueueClient(String region, String accountId) {
    this(region, accountId, Clock.systemUTC());
  }

  InMemoryQueueClient(String region, String accountId, Clock clock) {
    this.region = Objects.requireNonNull(region, "region");
    this.accountId = Objects.requireNonNull(accountId, "accountId");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public QueueHandle createQueue(String name, Map<String, String> attributes) {
    Objects.requireNonNull(name, "name");
    Map<String, String> requested = attributes == null ? Map.of() : attributes;
    StoredQueue created = new StoredQueue(name, "memory://" + accountId + "/" + name, requested);
    StoredQueue existing = queues.putIfAbsent(name, created);
    if (existing == null) {
      return created.handle();
    }
    existing.lock.lock();
    try {
      for (Map.Entry<String, String> entry : requested.entrySet()) {
        if (!entry.getValue().equals(existing.attributes.get(entry.getKey()))) {
          throw new QueueAlreadyExistsException(name);
        }
      }
    } finally {
      existing.lock.unlock();
    }
    return existing.handle();
  }

  @Override
  public QueueHandle getQueueInfo(String name) {
    return queue(Operation.GET_INFO, name).handle();
  }

  @Override
  public void setQueueAttributes(QueueHandle queue, Map<String, String> attributes) {
    StoredQueue stored = queue(Operation.SET_ATTRIBUTES, queue.name());
    stored.lock.lock();
    try {
      stored.attributes.putAll(attributes);
    } finally {
      stored.lock.unlock();
    }
  }

  @Override
  public List<QueueMessage> receiveMessages(QueueHandle queue, int maxMessages, int visibilityTimeoutSeconds,
                                            int waitTimeSeconds) {
    if (maxMessages < 1 || maxMessages > 10) {
      throw new QueueOperationException(Operation.RECEIVE, queue.name(), "maxMessages must be in [1, 10]");
    }
    StoredQueue stored = queue(Operation.RECEIVE, queue.name());
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(Math.max(0, waitTimeSeconds));
    stored.lock.lock();
    try {
      while (true) {
        List<QueueMessage> received = stored.receive(maxMessages, visibilityTimeoutSeconds);
        if (!received.isEmpty()) {
          return received;
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return List.of();
        }
        try {
          stored.messageAvailable.awaitNanos(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(MAX_WAIT_SLICE_MS)));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return List.of();
        }
      }
    } finally {
      stored.lock.unlock();
    }
  }

  @Override
  public void deleteMessage(QueueHandle queue, String receiptHandle) {
    StoredQueue stored = queue(Operation.DELETE, queue.name());
    stored.lock.lock();
    try {
      Iterator<StoredMessage> it = stored.messages.iterator();
      while (it.hasNext()) {
        if (receiptHandle.equals(it.next().receiptHandle)) {
          it.remove();
          return;
        }
      }
    } finally {
      stored.lock.unlock();
    }
    throw new QueueOperationException(Operation.DELETE, queue.name(), "Receipt handle is invalid: " + receiptHandle);
  }

  @Override
  public String sendMessage(QueueHandle queue, String body, Map<String, MessageAttributeValue> messageAttributes) {
    Objects.requireNonNull(body, "body");
    StoredQueue stored = queue(Operation.SEND, queue.name());
    long now = clock.millis();
    StoredMessage message = new StoredMessage(UlidCreator.getMonotonicUlid().toString(), body,
        messageAttributes == null ? Map.of() : Map.copyOf(messageAttributes), now);
    stored.lock.lock();
    try {
      message.invisibleUntil = now + stored.delaySeconds() * 1000L;
      stored.messages.add(message);
      stored.messageAvailable.signalAll();
    } finally {
      stored.lock.unlock();
    }
    return message.messageId;
  }

  /**
   * @return the names of all queues
   */
  public Set<String> queueNames() {
    return Set.copyOf(queues.keySet());
  }

  /**
   * Returns the bodies of every message still stored, visible or not, in send order.
   *
   * @param queueName the queue
   * @return message bodies
   */
  public List<String> bodies(String queueName) {
    StoredQueue stored = queue(Operation.GET_INFO, queueName);
    stored.lock.lock();
    try {
      List<String> bodies = new ArrayList<>(stored.messages.size());
      for (StoredMessage message : stored.messages) {
        bodies.add(message.body);
      }
      return bodies;
    } finally {
      stored.lock.unlock();
    }
  }

  /**
   * @return the number of stored messages, visible or not
   */
  public int size(String queueName) {
    StoredQueue stored = queue(Operation.GET_INFO, queueName);
    stored.lock.lock();
    try {
      return stored.messages.size();
    } finally {
      stored.lock.unlock();
    }
  }

  private StoredQueue queue(Operation operation, String name) {
    StoredQueue stored = queues.get(name);
    if (stored == null) {
      throw new QueueDoesNotExistException(operation, name);
    }
    return stored;
  }

  private final class StoredQueue {
    private final String name;
    private final String url;
    private final Map<String, String> attributes;
    private final List<StoredMessage> messages = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition messageAvailable = lock.newCondition();

    private StoredQueue(String name, String url, Map<String, String> attributes) {
      this.name = name;
      this.url = url;
      this.attributes = new LinkedHashMap<>(attributes);
    }

    QueueHandle handle() {
      lock.lock();
      try {
        Map<String, String> snapshot = new LinkedHashMap<>(attributes);
        snapshot.put("QueueArn", QueueArns.queueArn(region, accountId, name));
        snapshot.put("ApproximateNumberOfMessages", Integer.toString(messages.size()));
        return new QueueHandle(name, url, snapshot);
      } finally {
        lock.unlock();
      }
    }

    int delaySeconds() {
      String raw = attributes.get("DelaySeconds");
      if (raw == null) {
        return 0;
      }
      try {
        return Math.max(0, Integer.parseInt(raw.trim()));
      } catch (NumberFormatException e) {
        return 0;
      }
    }

    List<QueueMessage> receive(int maxMessages, int visibilityTimeoutSeconds) {
      long now = clock.millis();
      List<QueueMessage> received = new ArrayList<>();
      for (StoredMessage message : messages) {
        if (received.size() >= maxMessages) {
          break;
        }
        if (message.invisibleUntil > now) {
          continue;
        }
        message.receiveCount++;
        if (message.firstReceiveTimestamp == 0L) {
          message.firstReceiveTimestamp = now;
        }
        message.receiptHandle = UlidCreator.getMonotonicUlid().toString();
        message.invisibleUntil = now + visibilityTimeoutSeconds * 1000L;
        received.add(message.toQueueMessage());
      }
      return received;
    }
  }

  private static final class StoredMessage {
    private final String messageId;
    private final String body;
    private final String md5OfBody;
    private final Map<String, MessageAttributeValue> messageAttributes;
    private final long sentTimestamp;
    private int receiveCount;
    private long firstReceiveTimestamp;
    private long invisibleUntil;
    private String receiptHandle;

    private StoredMessage(String messageId, String body, Map<String, MessageAttributeValue> messageAttributes,
                          long sentTimestamp) {
      this.messageId = messageId;
      this.body = body;
      this.md5OfBody = EventBuilder.md5Hex(body);
      this.messageAttributes = messageAttributes;
      this.sentTimestamp = sentTimestamp;
    }

    QueueMessage toQueueMessage() {
      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put(QueueMessage.APPROXIMATE_RECEIVE_COUNT, Integer.toString(receiveCount));
      attributes.put(QueueMessage.SENT_TIMESTAMP, Long.toString(sentTimestamp));
      attributes.put(QueueMessage.APPROXIMATE_FIRST_RECEIVE_TIMESTAMP, Long.toString(firstReceiveTimestamp));
      return new QueueMessage(messageId, receiptHandle, body, attributes, messageAttributes, md5OfBody);
    }
  }
}
