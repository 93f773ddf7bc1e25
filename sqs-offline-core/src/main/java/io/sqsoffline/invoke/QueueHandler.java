package io.sqsoffline.invoke;

import io.sqsoffline.event.SqsEvent;

/**
 * A queue handler that completes by returning.
 *
 * <p>Returning a value (or {@code null}) reports success. Returning a
 * {@link java.util.concurrent.CompletionStage} defers the outcome to that stage. Throwing
 * reports failure. The handler may also settle early through
 * {@link InvocationContext#succeed(Object)} or {@link InvocationContext#fail(Throwable)}, in
 * which case the return value is ignored.
 */
@FunctionalInterface
public interface QueueHandler {

  Object handle(SqsEvent event, InvocationContext context) throws Exception;
}
