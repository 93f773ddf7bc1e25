package io.sqsoffline.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the local queue emulator.
 *
 * <p>Global settings apply to every queue that does not override them.
 *
 * @see SqsOfflineAutoConfiguration
 */
@ConfigurationProperties(prefix = "sqs-offline")
public class SqsOfflineProperties {

    /**
     * Master switch. When false, no emulator is created.
     */
    private boolean enabled = true;

    private String region = "us-east-1";
    private String accountId = "000000000000";

    /**
     * SQS endpoint, e.g. {@code http://localhost:4566}. When set, queues live behind this
     * endpoint instead of in memory.
     */
    private String endpoint;
    private String accessKeyId = "test";
    private String secretAccessKey = "test";

    /**
     * Whether queues and dead-letter queues are created at startup.
     */
    private boolean autoCreate = true;

    private Duration pollInterval = Duration.ofSeconds(1);
    private int maxConcurrentPolls = 3;
    private int visibilityTimeout = 30;
    private int waitTimeSeconds = 20;
    private int maxReceiveCount = 3;
    private String deadLetterQueueSuffix = "-dlq";

    /**
     * Reuse handlers after the first load instead of reloading them on every invocation.
     */
    private boolean skipCacheInvalidation = false;

    private Duration handlerTimeout = Duration.ofSeconds(30);
    private int batchSize = 1;
    private Duration drainTimeout = Duration.ofSeconds(5);

    /**
     * Class directories or jars searched for handler classes, reloaded on every invocation.
     */
    private List<String> handlerRoots = new ArrayList<>();

    private final List<Queue> queues = new ArrayList<>();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getAccessKeyId() {
        return accessKeyId;
    }

    public void setAccessKeyId(String accessKeyId) {
        this.accessKeyId = accessKeyId;
    }

    public String getSecretAccessKey() {
        return secretAccessKey;
    }

    public void setSecretAccessKey(String secretAccessKey) {
        this.secretAccessKey = secretAccessKey;
    }

    public boolean isAutoCreate() {
        return autoCreate;
    }

    public void setAutoCreate(boolean autoCreate) {
        this.autoCreate = autoCreate;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxConcurrentPolls() {
        return maxConcurrentPolls;
    }

    public void setMaxConcurrentPolls(int maxConcurrentPolls) {
        this.maxConcurrentPolls = maxConcurrentPolls;
    }

    public int getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public void setVisibilityTimeout(int visibilityTimeout) {
        this.visibilityTimeout = visibilityTimeout;
    }

    public int getWaitTimeSeconds() {
        return waitTimeSeconds;
    }

    public void setWaitTimeSeconds(int waitTimeSeconds) {
        this.waitTimeSeconds = waitTimeSeconds;
    }

    public int getMaxReceiveCount() {
        return maxReceiveCount;
    }

    public void setMaxReceiveCount(int maxReceiveCount) {
        this.maxReceiveCount = maxReceiveCount;
    }

    public String getDeadLetterQueueSuffix() {
        return deadLetterQueueSuffix;
    }

    public void setDeadLetterQueueSuffix(String deadLetterQueueSuffix) {
        this.deadLetterQueueSuffix = deadLetterQueueSuffix;
    }

    public boolean isSkipCacheInvalidation() {
        return skipCacheInvalidation;
    }

    public void setSkipCacheInvalidation(boolean skipCacheInvalidation) {
        this.skipCacheInvalidation = skipCacheInvalidation;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public void setHandlerTimeout(Duration handlerTimeout) {
        this.handlerTimeout = handlerTimeout;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public List<String> getHandlerRoots() {
        return handlerRoots;
    }

    public void setHandlerRoots(List<String> handlerRoots) {
        this.handlerRoots = handlerRoots;
    }

    public List<Queue> getQueues() {
        return queues;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * One polled queue. Unset numeric fields inherit the global value.
     */
    public static class Queue {
        private String name;
        private String handler;
        private boolean enabled = true;
        private Integer batchSize;
        private Integer concurrencyLimit;
        private Integer visibilityTimeout;
        private Integer waitTimeSeconds;
        private Duration handlerTimeout;
        private Integer maxReceiveCount;
        private boolean deadLetterQueue = false;
        private String deadLetterQueueName;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getHandler() {
            return handler;
        }

        public void setHandler(String handler) {
            this.handler = handler;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Integer getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(Integer batchSize) {
            this.batchSize = batchSize;
        }

        public Integer getConcurrencyLimit() {
            return concurrencyLimit;
        }

        public void setConcurrencyLimit(Integer concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
        }

        public Integer getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Integer visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public Integer getWaitTimeSeconds() {
            return waitTimeSeconds;
        }

        public void setWaitTimeSeconds(Integer waitTimeSeconds) {
            this.waitTimeSeconds = waitTimeSeconds;
        }

        public Duration getHandlerTimeout() {
            return handlerTimeout;
        }

        public void setHandlerTimeout(Duration handlerTimeout) {
            this.handlerTimeout = handlerTimeout;
        }

        public Integer getMaxReceiveCount() {
            return maxReceiveCount;
        }

        public void setMaxReceiveCount(Integer maxReceiveCount) {
            this.maxReceiveCount = maxReceiveCount;
        }

        public boolean isDeadLetterQueue() {
            return deadLetterQueue;
        }

        public void setDeadLetterQueue(boolean deadLetterQueue) {
            this.deadLetterQueue = deadLetterQueue;
        }

        public String getDeadLetterQueueName() {
            return deadLetterQueueName;
        }

        public void setDeadLetterQueueName(String deadLetterQueueName) {
            this.deadLetterQueueName = deadLetterQueueName;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "sqs.offline";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
