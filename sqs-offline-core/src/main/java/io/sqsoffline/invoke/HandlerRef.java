package io.sqsoffline.invoke;

import java.util.Objects;

/**
 * A parsed handler reference {@code <module>.<export>}, split at the last {@code '.'}.
 *
 * <p>For {@code handlers.Orders.process} the module is {@code handlers.Orders} and the
 * export is {@code process}.
 *
 * @param module the code artifact
 * @param export the entry point inside it
 */
public record HandlerRef(String module, String export) {

  public HandlerRef {
    Objects.requireNonNull(module, "module");
    Objects.requireNonNull(export, "export");
  }

  /**
   * Parses a handler reference.
   *
   * @param handlerRef the reference
   * @return the parsed reference
   * @throws HandlerNotFoundException if the reference has no {@code '.'} or an empty part
   */
  public static HandlerRef parse(String handlerRef) throws HandlerNotFoundException {
    if (handlerRef == null) {
      throw new HandlerNotFoundException(null, "Handler reference is null");
    }
    int idx = handlerRef.lastIndexOf('.');
    if (idx <= 0 || idx == handlerRef.length() - 1) {
      throw new HandlerNotFoundException(handlerRef,
          "Invalid handler reference '" + handlerRef + "', expected <module>.<export>");
    }
    return new HandlerRef(handlerRef.substring(0, idx), handlerRef.substring(idx + 1));
  }

  @Override
  public String toString() {
    return module + "." + export;
  }
}
