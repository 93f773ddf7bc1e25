package io.sqsoffline.invoke;

import io.sqsoffline.event.SqsEvent;

/**
 * A queue handler that completes through a {@link Callback} or the context signals.
 *
 * <p>Returning from {@link #handle} does not complete the invocation: until the callback
 * or a context signal fires, the invocation runs until its deadline. Throwing reports
 * failure.
 */
@FunctionalInterface
public interface CallbackQueueHandler {

  void handle(SqsEvent event, InvocationContext context, Callback callback) throws Exception;
}
