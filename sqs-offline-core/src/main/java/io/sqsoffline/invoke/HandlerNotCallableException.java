package io.sqsoffline.invoke;

/**
 * The code artifact was found but the named export is missing or is not a handler.
 */
public class HandlerNotCallableException extends HandlerException {

  public HandlerNotCallableException(String handlerRef, String message) {
    super(handlerRef, message);
  }

  public HandlerNotCallableException(String handlerRef, String message, Throwable cause) {
    super(handlerRef, message, cause);
  }
}
