/**
 * Queue polling and message delivery.
 *
 * <p>{@link io.sqsoffline.delivery.DeliveryEngine} owns one loop per queue and handler,
 * bounded per-queue handler concurrency, and the delete / leave / redrive decision after each
 * invocation. Loop progress is exposed as {@link io.sqsoffline.delivery.PollerStatus}
 * snapshots.
 */
package io.sqsoffline.delivery;
