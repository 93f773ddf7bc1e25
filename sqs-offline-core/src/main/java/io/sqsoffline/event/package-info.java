/**
 * The invocation event handed to queue handlers.
 *
 * <p>{@link io.sqsoffline.event.EventBuilder} converts a received
 * {@link io.sqsoffline.model.QueueMessage} into a single-record {@link io.sqsoffline.event.SqsEvent}.
 */
package io.sqsoffline.event;
