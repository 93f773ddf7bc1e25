package io.sqsoffline.invoke;

/**
 * The code artifact a handler reference points to does not exist, or the reference is malformed.
 */
public class HandlerNotFoundException extends HandlerException {

  public HandlerNotFoundException(String handlerRef, String message) {
    super(handlerRef, message);
  }

  public HandlerNotFoundException(String handlerRef, String message, Throwable cause) {
    super(handlerRef, message, cause);
  }
}
