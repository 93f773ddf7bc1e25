/**
 * Queue provisioning.
 *
 * <p>{@link io.sqsoffline.provision.QueueProvisioner} creates configured queues and
 * dead-letter queues (or queues declared as infrastructure resources), tolerating
 * per-queue failures. Names from resource definitions go through
 * {@link io.sqsoffline.provision.QueueNames#sanitize(String)}. Resolved handles land in the
 * shared {@link io.sqsoffline.provision.QueueRegistry}.
 */
package io.sqsoffline.provision;
