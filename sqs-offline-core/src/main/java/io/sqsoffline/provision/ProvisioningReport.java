package io.sqsoffline.provision;

import io.sqsoffline.model.QueueHandle;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a provisioning run: the queues that now exist and the ones that failed.
 *
 * @param provisioned handles of created or resolved queues, dead-letter queues included
 * @param failures    per-queue failures
 */
public record ProvisioningReport(List<QueueHandle> provisioned, List<ProvisioningFailure> failures) {
    private static final ProvisioningReport EMPTY = new ProvisioningReport(List.of(), List.of());

    public ProvisioningReport {
        provisioned = List.copyOf(provisioned);
        failures = List.copyOf(failures);
    }

    public static ProvisioningReport empty() {
        return EMPTY;
    }

    /**
     * @return {@code true} when no queue failed
     */
    public boolean isSuccess() {
        return failures.isEmpty();
    }

    /**
     * Merges two reports, keeping the order of each.
     */
    public ProvisioningReport merge(ProvisioningReport other) {
        List<QueueHandle> handles = new ArrayList<>(provisioned);
        handles.addAll(other.provisioned);
        List<ProvisioningFailure> errors = new ArrayList<>(failures);
        errors.addAll(other.failures);
        return new ProvisioningReport(handles, errors);
    }
}
