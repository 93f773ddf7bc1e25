/**
 * Service provider interfaces.
 *
 * <p>{@link io.sqsoffline.spi.QueueClient} is the transport the provisioner and delivery
 * engine talk to; it is the only seam to the queue backend. Failures are reported as
 * unchecked {@link io.sqsoffline.spi.QueueOperationException}s tagged with the failing
 * operation. {@link io.sqsoffline.spi.MetricsExporter} bridges delivery counters into a
 * metrics system; see the {@code sqs-offline-micrometer} module for a Micrometer binding.
 */
package io.sqsoffline.spi;
