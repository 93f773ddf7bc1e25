package io.sqsoffline.invoke;

import io.sqsoffline.event.SqsEvent;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Uniform entry point the invoker calls, whatever completion protocol the handler uses.
 *
 * <p>Implementations report completion through {@code callback}; an exception thrown from
 * {@link #invoke} is reported as failure by the invoker.
 */
@FunctionalInterface
public interface InvocableHandler {

  void invoke(SqsEvent event, InvocationContext context, Callback callback) throws Exception;

  /**
   * Adapts a returning handler. A returned {@link CompletionStage} is awaited.
   */
  static InvocableHandler of(QueueHandler handler) {
    return (event, context, callback) -> {
      Object result = handler.handle(event, context);
      if (result instanceof CompletionStage<?> stage) {
        stage.whenComplete((value, error) -> callback.complete(unwrap(error), value));
      } else {
        callback.complete(null, result);
      }
    };
  }

  static InvocableHandler of(CallbackQueueHandler handler) {
    return handler::handle;
  }

  /**
   * Adapts a handler object, which must implement {@link QueueHandler},
   * {@link CallbackQueueHandler} or this interface.
   *
   * @param handler the handler object
   * @return the adapted handler, or {@code null} if {@code handler} is none of those
   */
  static InvocableHandler adapt(Object handler) {
    if (handler instanceof InvocableHandler invocable) {
      return invocable;
    }
    if (handler instanceof QueueHandler queueHandler) {
      return of(queueHandler);
    }
    if (handler instanceof CallbackQueueHandler callbackHandler) {
      return of(callbackHandler);
    }
    return null;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
