package io.sqsoffline.invoke;

/**
 * Resolves handler references to invocable handlers.
 *
 * @see DefaultHandlerRegistry
 * @see ClassDirectoryHandlerLoader
 * @see CompositeHandlerLoader
 */
public interface HandlerLoader {

  /**
   * Resolves a handler reference.
   *
   * @param handlerRef the reference, {@code <module>.<export>}
   * @return the handler
   * @throws HandlerNotFoundException    if the code artifact does not exist
   * @throws HandlerNotCallableException if the export is missing or not a handler
   */
  InvocableHandler resolve(String handlerRef) throws HandlerException;

  /**
   * Discards whatever this loader cached for {@code handlerRef}, so the next
   * {@link #resolve} loads the code again. Default: nothing cached.
   */
  default void invalidate(String handlerRef) {
  }
}
