package io.sqsoffline.provision;

import io.sqsoffline.config.DeadLetterPolicy;
import io.sqsoffline.config.QueueDescriptor;
import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.spi.QueueAlreadyExistsException;
import io.sqsoffline.spi.QueueClient;
import io.sqsoffline.util.JsonCodec;
import io.sqsoffline.util.QueueArns;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ensures queues and their dead-letter queues exist on the backend.
 *
 * <p>Two entry points:
 * <ul>
 *   <li>{@link #ensureQueues(List)} provisions configured {@link QueueDescriptor}s</li>
 *   <li>{@link #provisionResources(Map)} provisions declarative infrastructure resources
 *       (logical id to {@code {Type, Properties}})</li>
 * </ul>
 *
 * <p>Each queue is attempted independently: a failure is logged and reported as a
 * {@link ProvisioningFailure}, and the run continues with the next queue. An
 * "already exists" response resolves to the existing queue. Resolved handles are cached
 * in the {@link QueueRegistry}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class QueueProvisioner {
    private static final Logger logger = Logger.getLogger(QueueProvisioner.class.getName());

    static final String QUEUE_RESOURCE_TYPE = "AWS::SQS::Queue";
    static final String VISIBILITY_TIMEOUT = "VisibilityTimeout";
    static final String RECEIVE_MESSAGE_WAIT_TIME_SECONDS = "ReceiveMessageWaitTimeSeconds";
    static final String MESSAGE_RETENTION_PERIOD = "MessageRetentionPeriod";
    static final String DELAY_SECONDS = "DelaySeconds";
    static final String REDRIVE_POLICY = "RedrivePolicy";

    private static final List<String> RESOURCE_ATTRIBUTES = List.of(
            VISIBILITY_TIMEOUT, RECEIVE_MESSAGE_WAIT_TIME_SECONDS, MESSAGE_RETENTION_PERIOD, DELAY_SECONDS);

    private final QueueClient queueClient;
    private final QueueRegistry registry;
    private final SqsOfflineConfig config;
    private final JsonCodec jsonCodec;

    private QueueProvisioner(Builder builder) {
        this.queueClient = Objects.requireNonNull(builder.queueClient, "queueClient");
        this.registry = builder.registry != null ? builder.registry : new QueueRegistry();
        this.config = builder.config != null ? builder.config : SqsOfflineConfig.defaults();
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    }

    public static Builder builder() {
        return new Builder();
    }

    public QueueRegistry registry() {
        return registry;
    }

    /**
     * Creates every descriptor's queue, and its dead-letter queue first when enabled.
     *
     * @param descriptors the queues to provision
     * @return provisioned handles and per-queue failures; empty when auto-creation is off
     */
    public ProvisioningReport ensureQueues(List<QueueDescriptor> descriptors) {
        if (!config.autoCreate()) {
            logger.fine("Queue auto-creation disabled");
            return ProvisioningReport.empty();
        }
        logger.info("Creating " + descriptors.size() + " queue(s) from configuration");
        Map<String, QueueHandle> provisioned = new LinkedHashMap<>();
        List<ProvisioningFailure> failures = new ArrayList<>();
        for (QueueDescriptor descriptor : descriptors) {
            try {
                provisionDescriptor(descriptor, provisioned);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to create queue " + descriptor.name(), e);
                failures.add(new ProvisioningFailure(descriptor.name(), e));
            }
        }
        return new ProvisioningReport(new ArrayList<>(provisioned.values()), failures);
    }

    private void provisionDescriptor(QueueDescriptor descriptor, Map<String, QueueHandle> provisioned) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(VISIBILITY_TIMEOUT, Integer.toString(descriptor.visibilityTimeoutSeconds()));
        attributes.put(RECEIVE_MESSAGE_WAIT_TIME_SECONDS, Integer.toString(descriptor.longPollWaitSeconds()));

        DeadLetterPolicy deadLetter = descriptor.deadLetterPolicy();
        if (deadLetter.enabled()) {
            QueueHandle dlq = createOrResolve(deadLetter.queueName(), Map.of());
            provisioned.put(dlq.name(), dlq);
            attributes.put(REDRIVE_POLICY, redrivePolicy(queueArn(deadLetter.queueName()), deadLetter.maxDeliveryAttempts()));
        }

        QueueHandle queue = createOrResolve(descriptor.name(), attributes);
        provisioned.put(queue.name(), queue);
        logger.info("Created queue: " + descriptor.name() + " with handler: " + descriptor.handlerRef());
    }

    /**
     * Creates the queues declared by infrastructure resource definitions.
     *
     * <p>Entries whose {@code Type} is {@value #QUEUE_RESOURCE_TYPE} are queues; everything else
     * is ignored. Queue names come from {@code Properties.QueueName} (falling back to the
     * logical id) and are sanitized. A redrive target may be a literal ARN, a
     * {@code Fn::GetAtt}/{@code Ref} reference to another resource, or absent. Dead-letter
     * queues are created before the queues that reference them.
     *
     * @param resources logical id to resource definition
     * @return provisioned handles and per-queue failures; empty when auto-creation is off
     */
    public ProvisioningReport provisionResources(Map<String, ?> resources) {
        if (!config.autoCreate()) {
            logger.fine("Queue auto-creation disabled");
            return ProvisioningReport.empty();
        }
        Map<String, QueueResource> queues = extractQueueResources(resources);
        if (queues.isEmpty()) {
            logger.fine("No queue resources found");
            return ProvisioningReport.empty();
        }
        logger.info("Found " + queues.size() + " queue resource(s)");

        Map<String, String> namesByLogicalId = new LinkedHashMap<>();
        queues.forEach((logicalId, resource) -> namesByLogicalId.put(logicalId, resource.queueName()));

        Map<String, ResolvedResource> resolved = new LinkedHashMap<>();
        for (QueueResource resource : queues.values()) {
            resolved.put(resource.logicalId(), resolve(resource, namesByLogicalId));
        }

        Map<String, QueueHandle> provisioned = new LinkedHashMap<>();
        List<ProvisioningFailure> failures = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String logicalId : resolved.keySet()) {
            provisionInOrder(logicalId, resolved, namesByLogicalId, visited, provisioned, failures);
        }
        return new ProvisioningReport(new ArrayList<>(provisioned.values()), failures);
    }

    private void provisionInOrder(String logicalId,
                                  Map<String, ResolvedResource> resolved,
                                  Map<String, String> namesByLogicalId,
                                  Set<String> visited,
                                  Map<String, QueueHandle> provisioned,
                                  List<ProvisioningFailure> failures) {
        if (!visited.add(logicalId)) {
            return;
        }
        ResolvedResource resource = resolved.get(logicalId);
        String dlqName = resource.deadLetterQueueName();
        if (dlqName != null) {
            String dlqLogicalId = logicalIdForName(dlqName, namesByLogicalId);
            if (dlqLogicalId != null) {
                provisionInOrder(dlqLogicalId, resolved, namesByLogicalId, visited, provisioned, failures);
            } else if (!provisioned.containsKey(dlqName)) {
                try {
                    QueueHandle dlq = createOrResolve(dlqName, Map.of());
                    provisioned.put(dlq.name(), dlq);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to create dead-letter queue " + dlqName, e);
                    failures.add(new ProvisioningFailure(dlqName, e));
                }
            }
        }
        try {
            QueueHandle queue = createOrResolve(resource.queueName(), resource.attributes());
            provisioned.put(queue.name(), queue);
            logger.info("Created queue from resource " + logicalId + ": " + queue.name());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to create queue " + resource.queueName(), e);
            failures.add(new ProvisioningFailure(resource.queueName(), e));
        }
    }

    private static String logicalIdForName(String queueName, Map<String, String> namesByLogicalId) {
        for (Map.Entry<String, String> entry : namesByLogicalId.entrySet()) {
            if (entry.getValue().equals(queueName)) {
                return entry.getKey();
            }
        }
        return null;
    }

    private Map<String, QueueResource> extractQueueResources(Map<String, ?> resources) {
        Map<String, QueueResource> queues = new LinkedHashMap<>();
        if (resources == null) {
            return queues;
        }
        for (Map.Entry<String, ?> entry : resources.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> resource) || !QUEUE_RESOURCE_TYPE.equals(resource.get("Type"))) {
                continue;
            }
            Map<?, ?> properties = resource.get("Properties") instanceof Map<?, ?> p ? p : Map.of();
            Object rawName = properties.get("QueueName");
            String queueName = QueueNames.sanitize(rawName instanceof String s ? s : entry.getKey());

            Map<String, String> attributes = new LinkedHashMap<>();
            for (String attribute : RESOURCE_ATTRIBUTES) {
                Object value = properties.get(attribute);
                if (value != null) {
                    attributes.put(attribute, value.toString());
                }
            }
            Map<?, ?> redrive = properties.get(REDRIVE_POLICY) instanceof Map<?, ?> r ? r : null;
            queues.put(entry.getKey(), new QueueResource(entry.getKey(), queueName, attributes, redrive));
        }
        return queues;
    }

    private ResolvedResource resolve(QueueResource resource, Map<String, String> namesByLogicalId) {
        Map<String, String> attributes = new LinkedHashMap<>(resource.attributes());
        if (resource.redrivePolicy() == null) {
            return new ResolvedResource(resource.queueName(), attributes, null);
        }
        Object target = resource.redrivePolicy().get("deadLetterTargetArn");
        String dlqName;
        String dlqArn;
        if (target == null) {
            logger.fine("Queue " + resource.queueName() + " has a redrive policy without target; skipping dead-letter wiring");
            return new ResolvedResource(resource.queueName(), attributes, null);
        } else if (target instanceof String arn) {
            dlqName = QueueNames.sanitize(QueueArns.resourceName(arn));
            dlqArn = arn;
        } else {
            String referencedId = referencedLogicalId(target);
            if (referencedId == null) {
                logger.warning("Unsupported deadLetterTargetArn for queue " + resource.queueName() + ": " + target);
                return new ResolvedResource(resource.queueName(), attributes, null);
            }
            dlqName = namesByLogicalId.getOrDefault(referencedId, QueueNames.sanitize(referencedId));
            dlqArn = queueArn(dlqName);
        }
        Object maxReceiveCount = resource.redrivePolicy().get("maxReceiveCount");
        int maxAttempts = maxReceiveCount instanceof Number n ? n.intValue() : parseOrDefault(maxReceiveCount);
        attributes.put(REDRIVE_POLICY, redrivePolicy(dlqArn, maxAttempts));
        return new ResolvedResource(resource.queueName(), attributes, dlqName);
    }

    private int parseOrDefault(Object value) {
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid maxReceiveCount '" + s + "', using " + config.maxReceiveCount());
            }
        }
        return config.maxReceiveCount();
    }

    /**
     * Extracts the logical id from {@code {"Fn::GetAtt": [id, "Arn"]}}, {@code {"Fn::GetAtt": "id.Arn"}}
     * or {@code {"Ref": id}}.
     */
    static String referencedLogicalId(Object reference) {
        if (!(reference instanceof Map<?, ?> map)) {
            return null;
        }
        Object getAtt = map.get("Fn::GetAtt");
        if (getAtt instanceof List<?> parts && !parts.isEmpty() && parts.get(0) instanceof String id) {
            return id;
        }
        if (getAtt instanceof String dotted) {
            int dot = dotted.indexOf('.');
            return dot < 0 ? dotted : dotted.substring(0, dot);
        }
        if (map.get("Ref") instanceof String ref) {
            return ref;
        }
        return null;
    }

    private QueueHandle createOrResolve(String name, Map<String, String> attributes) {
        QueueHandle handle;
        try {
            handle = queueClient.createQueue(name, attributes);
        } catch (QueueAlreadyExistsException e) {
            logger.fine("Queue " + name + " already exists, resolving");
            handle = queueClient.getQueueInfo(name);
        }
        registry.register(handle);
        return handle;
    }

    private String redrivePolicy(String deadLetterTargetArn, int maxReceiveCount) {
        Map<String, Object> policy = new LinkedHashMap<>();
        policy.put("deadLetterTargetArn", deadLetterTargetArn);
        policy.put("maxReceiveCount", maxReceiveCount);
        return jsonCodec.toJson(policy);
    }

    private String queueArn(String queueName) {
        return QueueArns.queueArn(config.region(), config.accountId(), queueName);
    }

    private record QueueResource(String logicalId, String queueName, Map<String, String> attributes,
                                 Map<?, ?> redrivePolicy) {
    }

    private record ResolvedResource(String queueName, Map<String, String> attributes, String deadLetterQueueName) {
    }

    /**
     * Builder for {@link QueueProvisioner}.
     */
    public static final class Builder {
        private QueueClient queueClient;
        private QueueRegistry registry;
        private SqsOfflineConfig config;
        private JsonCodec jsonCodec;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder queueClient(QueueClient queueClient) {
            this.queueClient = queueClient;
            return this;
        }

        /**
         * Registry receiving every resolved handle.
         *
         * <p>Optional. Defaults to a new, private registry.
         */
        public Builder registry(QueueRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Supplies {@code autoCreate}, region, account id and the default {@code maxReceiveCount}.
         *
         * <p>Optional. Defaults to {@link SqsOfflineConfig#defaults()}.
         */
        public Builder config(SqsOfflineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        public QueueProvisioner build() {
            return new QueueProvisioner(this);
        }
    }
}
