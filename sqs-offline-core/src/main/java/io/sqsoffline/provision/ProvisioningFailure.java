package io.sqsoffline.provision;

import java.util.Objects;

/**
 * A queue that could not be provisioned.
 *
 * @param queueName the queue
 * @param error     the cause
 */
public record ProvisioningFailure(String queueName, Throwable error) {

    public ProvisioningFailure {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(error, "error");
    }

    public String message() {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
