package io.sqsoffline.invoke;

import java.time.Duration;

/**
 * The handler did not complete before its deadline.
 */
public class HandlerTimeoutException extends HandlerException {
  private final Duration timeout;

  public HandlerTimeoutException(String handlerRef, Duration timeout) {
    super(handlerRef, "Handler " + handlerRef + " timed out after " + timeout.toMillis() + "ms");
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
