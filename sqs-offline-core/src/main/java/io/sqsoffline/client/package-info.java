/**
 * Embedded {@link io.sqsoffline.spi.QueueClient} implementation.
 */
package io.sqsoffline.client;
