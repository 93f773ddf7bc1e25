/**
 * Local emulation of queue-triggered function invocation.
 *
 * <h2>Architecture</h2>
 * <pre>
 *   SqsOffline.start()
 *       |
 *       +--&gt; QueueProvisioner ---&gt; create DLQs, then queues (QueueClient)
 *       |
 *       +--&gt; DeliveryEngine: one loop per queue
 *                 |
 *                 +--&gt; receive batch ---&gt; sub-batches of concurrencyLimit
 *                 |                            |
 *                 |                            +--&gt; HandlerInvoker (concurrent, under deadline)
 *                 |
 *                 +--&gt; Success: delete | Failure: leave, or redrive to DLQ past maxDeliveryAttempts
 * </pre>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link io.sqsoffline.SqsOffline}: composite lifecycle entry point</li>
 *   <li>{@link io.sqsoffline.provision.QueueProvisioner}: creates queues and dead-letter queues</li>
 *   <li>{@link io.sqsoffline.invoke.HandlerInvoker}: loads and runs handlers with hot reload</li>
 *   <li>{@link io.sqsoffline.delivery.DeliveryEngine}: polling loops, retry and dead-lettering</li>
 *   <li>{@link io.sqsoffline.spi.QueueClient}: backend transport SPI</li>
 *   <li>{@link io.sqsoffline.client.InMemoryQueueClient}: embedded backend for tests and demos</li>
 * </ul>
 *
 * <h2>Delivery Semantics</h2>
 * <p>At-least-once. A message whose handler succeeds is deleted; a failed message comes back
 * after its visibility timeout. Once its receive count reaches {@code maxDeliveryAttempts} it
 * is moved to the dead-letter queue, or, without one, retried indefinitely. Handlers must be
 * idempotent.
 *
 * <h2>Thread Safety</h2>
 * <p>All public components are thread-safe. Lifecycle methods are synchronized.
 */
package io.sqsoffline;
