package io.sqsoffline.aws;

import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.model.MessageAttributeValue;
import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.model.QueueMessage;
import io.sqsoffline.spi.QueueAlreadyExistsException;
import io.sqsoffline.spi.QueueClient;
import io.sqsoffline.spi.QueueDoesNotExistException;
import io.sqsoffline.spi.QueueOperationException;
import io.sqsoffline.spi.QueueOperationException.Operation;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;
import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueNameExistsException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SetQueueAttributesRequest;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link QueueClient} backed by the AWS SDK {@link SqsClient}, typically pointed at a local
 * emulator such as LocalStack.
 *
 * <p>Receive calls ask for all system attributes and all message attributes. SDK failures are
 * rethrown as {@link QueueOperationException}; a name clash on create becomes
 * {@link QueueAlreadyExistsException} and an unknown queue becomes
 * {@link QueueDoesNotExistException}.
 *
 * <pre>{@code
 * try (SqsQueueClient client = SqsQueueClient.builder()
 *     .endpoint("http://localhost:4566")
 *     .region("us-east-1")
 *     .credentials("test", "test")
 *     .build()) {
 *   QueueHandle orders = client.createQueue("orders", Map.of());
 * }
 * }</pre>
 */
public final class SqsQueueClient implements QueueClient, AutoCloseable {
  private static final Logger logger = Logger.getLogger(SqsQueueClient.class.getName());

  static final String ALL = "All";
  static final int MAX_BATCH_ENTRIES = 10;

  private final SqsClient sqs;
  private final boolean ownsClient;

  /**
   * Wraps an existing SDK client. The client is not closed by {@link #close()}.
   */
  public SqsQueueClient(SqsClient sqs) {
    this(sqs, false);
  }

  private SqsQueueClient(SqsClient sqs, boolean ownsClient) {
    this.sqs = Objects.requireNonNull(sqs, "sqs");
    this.ownsClient = ownsClient;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a client from the endpoint, region and credentials of {@code config}.
   */
  public static SqsQueueClient create(SqsOfflineConfig config) {
    return builder()
        .endpoint(config.endpoint())
        .region(config.region())
        .credentials(config.accessKeyId(), config.secretAccessKey())
        .build();
  }

  @Override
  public QueueHandle createQueue(String name, Map<String, String> attributes) {
    Map<String, String> requested = attributes == null ? Map.of() : attributes;
    try {
      String url = sqs.createQueue(CreateQueueRequest.builder()
          .queueName(name)
          .attributesWithStrings(requested)
          .build()).queueUrl();
      logger.fine(() -> "Created queue " + name + " at " + url);
      return new QueueHandle(name, url, requested);
    } catch (QueueNameExistsException e) {
      throw new QueueAlreadyExistsException(name, e);
    } catch (SdkException e) {
      throw new QueueOperationException(Operation.CREATE, name, "Failed to create queue " + name + ": " + e.getMessage(), e);
    }
  }

  @Override
  public QueueHandle getQueueInfo(String name) {
    try {
      String url = sqs.getQueueUrl(GetQueueUrlRequest.builder().queueName(name).build()).queueUrl();
      Map<String, String> attributes = sqs.getQueueAttributes(GetQueueAttributesRequest.builder()
          .queueUrl(url)
          .attributeNamesWithStrings(ALL)
          .build()).attributesAsStrings();
      return new QueueHandle(name, url, attributes);
    } catch (software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException e) {
      throw new QueueDoesNotExistException(Operation.GET_INFO, name, e);
    } catch (SdkException e) {
      throw new QueueOperationException(Operation.GET_INFO, name,
          "Failed to get queue info for " + name + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void setQueueAttributes(QueueHandle queue, Map<String, String> attributes) {
    try {
      sqs.setQueueAttributes(SetQueueAttributesRequest.builder()
          .queueUrl(queue.url())
          .attributesWithStrings(attributes)
          .build());
    } catch (software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException e) {
      throw new QueueDoesNotExistException(Operation.SET_ATTRIBUTES, queue.name(), e);
    } catch (SdkException e) {
      throw new QueueOperationException(Operation.SET_ATTRIBUTES, queue.name(),
          "Failed to set queue attributes: " + e.getMessage(), e);
    }
  }

  @Override
  public List<QueueMessage> receiveMessages(QueueHandle queue, int maxMessages, int visibilityTimeoutSeconds,
                                            int waitTimeSeconds) {
    List<Message> messages;
    try {
      messages = sqs.receiveMessage(ReceiveMessageRequest.builder()
          .queueUrl(queue.url())
          .maxNumberOfMessages(maxMessages)
          .visibilityTimeout(visibilityTimeoutSeconds)
          .waitTimeSeconds(waitTimeSeconds)
          .attributeNamesWithStrings(ALL)
          .messageAttributeNames(ALL)
          .build()).messages();
    } catch (software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException e) {
      throw new QueueDoesNotExistException(Operation.RECEIVE, queue.name(), e);
    } catch (SdkException e) {
      throw new QueueOperationException(Operation.RECEIVE, queue.name(),
          "Failed to receive messages from " + queue.name() + ": " + e.getMessage(), e);
    }
    List<QueueMessage> result = new ArrayList<>(messages.size());
    for (Message message : messages) {
      result.add(toQueueMessage(message));
    }
    return result;
  }

  @Override
  public void deleteMessage(QueueHandle queue, String receiptHandle) {
    try {
      sqs.deleteMessage(DeleteMessageRequest.builder()
          .queueUrl(queue.url())
          .receiptHandle(receiptHandle)
          .build());
    } catch (SdkException e) {
      throw new QueueOperationException(Operation.DELETE, queue.name(), "Failed to delete message: " + e.getMessage(), e);
    }
  }

  /**
   * Deletes in batches of {@value #MAX_BATCH_ENTRIES}.
   *
   * @throws QueueOperationException if any entry fails; the remaining batches are still sent
   */
  @Override
  public void deleteMessages(QueueHandle queue, Collection<String> receiptHandles) {
    List<String> handles = List.copyOf(receiptHandles);
    List<String> failures = new ArrayList<>();
    for (int from = 0; from < handles.size(); from += MAX_BATCH_ENTRIES) {
      List<DeleteMessageBatchRequestEntry> entries = new ArrayList<>();
      for (int i = from; i < Math.min(handles.size(), from + MAX_BATCH_ENTRIES); i++) {
        entries.add(DeleteMessageBatchRequestEntry.builder()
            .id(Integer.toString(i))
            .receiptHandle(handles.get(i))
            .build());
      }
      DeleteMessageBatchResponse response;
      try {
        response = sqs.deleteMessageBatch(DeleteMessageBatchRequest.builder()
            .queueUrl(queue.url())
            .entries(entries)
            .build());
      } catch (SdkException e) {
        throw new QueueOperationException(Operation.DELETE, queue.name(), "Failed to delete messages: " + e.getMessage(), e);
      }
      for (BatchResultErrorEntry failed : response.failed()) {
        failures.add(handles.get(Integer.parseInt(failed.id())) + " (" + failed.message() + ")");
      }
    }
    if (!failures.isEmpty()) {
      logger.warning("Failed to delete " + failures.size() + " message(s) from " + queue.name());
      throw new QueueOperationException(Operation.DELETE, queue.name(),
          "Failed to delete " + failures.size() + " message(s): " + failures);
    }
  }

  @Override
  public String sendMessage(QueueHandle queue, String body, Map<String, MessageAttributeValue> messageAttributes) {
    Map<String, software.amazon.awssdk.services.sqs.model.MessageAttributeValue> attributes = new LinkedHashMap<>();
    if (messageAttributes != null) {
      messageAttributes.forEach((name, value) -> attributes.put(name, toSdk(value)));
    }
    try {
      return sqs.sendMessage(SendMessageRequest.builder()
          .queueUrl(queue.url())
          .messageBody(body)
          .messageAttributes(attributes)
          .build()).messageId();
    } catch (software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException e) {
      throw new QueueDoesNotExistException(Operation.SEND, queue.name(), e);
    } catch (SdkException e) {
      throw new QueueOperationException(Operation.SEND, queue.name(),
          "Failed to send message to " + queue.name() + ": " + e.getMessage(), e);
    }
  }

  static QueueMessage toQueueMessage(Message message) {
    Map<String, MessageAttributeValue> attributes = new LinkedHashMap<>();
    message.messageAttributes().forEach((name, value) -> attributes.put(name, fromSdk(value)));
    return new QueueMessage(message.messageId(), message.receiptHandle(), message.body(),
        message.attributesAsStrings(), attributes, message.md5OfBody());
  }

  static MessageAttributeValue fromSdk(software.amazon.awssdk.services.sqs.model.MessageAttributeValue value) {
    List<byte[]> binaryList = new ArrayList<>(value.binaryListValues().size());
    for (SdkBytes bytes : value.binaryListValues()) {
      binaryList.add(bytes.asByteArray());
    }
    return new MessageAttributeValue(value.dataType(), value.stringValue(),
        value.binaryValue() == null ? null : value.binaryValue().asByteArray(),
        value.stringListValues(), binaryList);
  }

  static software.amazon.awssdk.services.sqs.model.MessageAttributeValue toSdk(MessageAttributeValue value) {
    software.amazon.awssdk.services.sqs.model.MessageAttributeValue.Builder builder =
        software.amazon.awssdk.services.sqs.model.MessageAttributeValue.builder()
            .dataType(value.dataType())
            .stringValue(value.stringValue());
    byte[] binary = value.binaryValue();
    if (binary != null) {
      builder.binaryValue(SdkBytes.fromByteArray(binary));
    }
    if (!value.stringListValues().isEmpty()) {
      builder.stringListValues(value.stringListValues());
    }
    if (!value.binaryListValues().isEmpty()) {
      List<SdkBytes> binaryList = new ArrayList<>(value.binaryListValues().size());
      for (byte[] bytes : value.binaryListValues()) {
        binaryList.add(SdkBytes.fromByteArray(bytes));
      }
      builder.binaryListValues(binaryList);
    }
    return builder.build();
  }

  /**
   * Closes the SDK client when this instance created it.
   */
  @Override
  public void close() {
    if (ownsClient) {
      sqs.close();
    }
  }

  /**
   * Builder creating an owned {@link SqsClient}.
   */
  public static final class Builder {
    private String endpoint;
    private String region = SqsOfflineConfig.DEFAULT_REGION;
    private String accessKeyId = SqsOfflineConfig.DEFAULT_ACCESS_KEY_ID;
    private String secretAccessKey = SqsOfflineConfig.DEFAULT_SECRET_ACCESS_KEY;

    private Builder() {
    }

    /**
     * <p>Optional. Defaults to the region's public endpoint.
     */
    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@value SqsOfflineConfig#DEFAULT_REGION}.
     */
    public Builder region(String region) {
      this.region = region;
      return this;
    }

    /**
     * Static credentials.
     *
     * <p>Optional. Defaults to {@code test}/{@code test}, which local emulators accept.
     */
    public Builder credentials(String accessKeyId, String secretAccessKey) {
      this.accessKeyId = accessKeyId;
      this.secretAccessKey = secretAccessKey;
      return this;
    }

    /**
     * @throws NullPointerException     if region or a credential is null
     * @throws IllegalArgumentException if the endpoint is not a valid URI
     */
    public SqsQueueClient build() {
      SqsClientBuilder builder = SqsClient.builder()
          .region(Region.of(Objects.requireNonNull(region, "region")))
          .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create(
              Objects.requireNonNull(accessKeyId, "accessKeyId"),
              Objects.requireNonNull(secretAccessKey, "secretAccessKey"))));
      if (endpoint != null && !endpoint.isBlank()) {
        builder.endpointOverride(URI.create(endpoint));
      }
      SqsClient sqs = builder.build();
      logger.fine(() -> "SQS client initialized with endpoint " + (endpoint != null ? endpoint : "default"));
      return new SqsQueueClient(sqs, true);
    }
  }
}
