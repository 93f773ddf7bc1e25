package io.sqsoffline.invoke;

/**
 * Base class for handler resolution and execution failures.
 */
public class HandlerException extends Exception {
  private final String handlerRef;

  public HandlerException(String handlerRef, String message) {
    super(message);
    this.handlerRef = handlerRef;
  }

  public HandlerException(String handlerRef, String message, Throwable cause) {
    super(message, cause);
    this.handlerRef = handlerRef;
  }

  public String handlerRef() {
    return handlerRef;
  }
}
