package io.sqsoffline.delivery;

import java.time.Instant;

/**
 * Immutable snapshot of a polling loop.
 *
 * @param pollerId          {@code <queueName>-<handlerRef>}
 * @param queueName         the polled queue
 * @param handlerRef        the handler
 * @param state             loop lifecycle state
 * @param polling           {@code true} while the loop is scheduled
 * @param messagesProcessed messages received so far
 * @param errorCount        receive errors plus handler failures so far
 * @param lastPollTime      start of the last cycle, or {@code null}
 * @param lastError         message of the last error, or {@code null}
 */
public record PollerStatus(
    String pollerId,
    String queueName,
    String handlerRef,
    LoopState state,
    boolean polling,
    long messagesProcessed,
    long errorCount,
    Instant lastPollTime,
    String lastError
) {
}
