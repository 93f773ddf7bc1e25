package io.sqsoffline.invoke;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one handler invocation.
 *
 * <ul>
 *   <li>{@link Success}: the handler completed; the message is deleted.</li>
 *   <li>{@link Failure}: the handler threw, reported an error, could not be loaded, or hit
 *       its deadline; retry and dead-letter rules apply.</li>
 * </ul>
 */
public sealed interface InvocationOutcome permits InvocationOutcome.Success, InvocationOutcome.Failure {

  /**
   * @return wall time from invocation start to settlement
   */
  Duration duration();

  default boolean isSuccess() {
    return this instanceof Success;
  }

  /**
   * @param value    the handler's result, may be {@code null}
   * @param duration time to settlement
   */
  record Success(Object value, Duration duration) implements InvocationOutcome {
    public Success {
      Objects.requireNonNull(duration, "duration");
    }
  }

  /**
   * @param error    the failure cause
   * @param duration time to settlement
   */
  record Failure(Throwable error, Duration duration) implements InvocationOutcome {
    public static final String DEFAULT_REASON = "Handler execution failed";

    public Failure {
      Objects.requireNonNull(error, "error");
      Objects.requireNonNull(duration, "duration");
    }

    /**
     * @return {@code true} when the handler hit its deadline
     */
    public boolean timedOut() {
      return error instanceof HandlerTimeoutException;
    }

    /**
     * @return the error message, or {@value #DEFAULT_REASON} when it has none
     */
    public String reason() {
      String message = error.getMessage();
      return message == null || message.isEmpty() ? DEFAULT_REASON : message;
    }
  }
}
