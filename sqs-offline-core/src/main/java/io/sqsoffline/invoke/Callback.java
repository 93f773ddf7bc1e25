package io.sqsoffline.invoke;

/**
 * Completion callback passed to a {@link CallbackQueueHandler}.
 *
 * <p>Only the first completion of an invocation counts; later calls are ignored.
 */
@FunctionalInterface
public interface Callback {

  /**
   * Reports completion.
   *
   * @param error  the failure, or {@code null} on success
   * @param result the result on success, may be {@code null}
   */
  void complete(Throwable error, Object result);

  default void success(Object result) {
    complete(null, result);
  }

  default void failure(Throwable error) {
    complete(error, null);
  }
}
