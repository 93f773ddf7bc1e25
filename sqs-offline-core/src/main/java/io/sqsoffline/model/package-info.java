/**
 * Immutable value types exchanged with the queue backend.
 *
 * <ul>
 *   <li>{@link io.sqsoffline.model.QueueHandle}: a resolved queue (name, URL, attributes)</li>
 *   <li>{@link io.sqsoffline.model.QueueMessage}: one received delivery, with its receive count</li>
 *   <li>{@link io.sqsoffline.model.MessageAttributeValue}: a user-defined message attribute</li>
 * </ul>
 */
package io.sqsoffline.model;
