package io.sqsoffline.invoke;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of in-process handlers, keyed by handler reference.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultHandlerRegistry handlers = new DefaultHandlerRegistry()
 *     .register("orders.process", (event, context) -> {
 *         orderService.apply(event.records().get(0).body());
 *         return null;
 *     })
 *     .register("audit.record", (event, context, callback) ->
 *         auditClient.sendAsync(event).whenComplete((r, e) -> callback.complete(e, r)));
 * }</pre>
 */
public final class DefaultHandlerRegistry implements HandlerLoader {
  private final Map<String, InvocableHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers a returning handler, replacing any previous registration.
   *
   * @param handlerRef reference in {@code <module>.<export>} form
   * @param handler    the handler
   * @return this registry for chaining
   * @throws IllegalArgumentException if {@code handlerRef} is not a valid reference
   */
  public DefaultHandlerRegistry register(String handlerRef, QueueHandler handler) {
    Objects.requireNonNull(handler, "handler");
    return put(handlerRef, InvocableHandler.of(handler));
  }

  /**
   * Registers a callback-style handler, replacing any previous registration.
   *
   * @param handlerRef reference in {@code <module>.<export>} form
   * @param handler    the handler
   * @return this registry for chaining
   * @throws IllegalArgumentException if {@code handlerRef} is not a valid reference
   */
  public DefaultHandlerRegistry register(String handlerRef, CallbackQueueHandler handler) {
    Objects.requireNonNull(handler, "handler");
    return put(handlerRef, InvocableHandler.of(handler));
  }

  public DefaultHandlerRegistry unregister(String handlerRef) {
    handlers.remove(handlerRef);
    return this;
  }

  public Set<String> handlerRefs() {
    return Set.copyOf(handlers.keySet());
  }

  private DefaultHandlerRegistry put(String handlerRef, InvocableHandler handler) {
    Objects.requireNonNull(handlerRef, "handlerRef");
    try {
      HandlerRef.parse(handlerRef);
    } catch (HandlerNotFoundException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
    handlers.put(handlerRef, handler);
    return this;
  }

  @Override
  public InvocableHandler resolve(String handlerRef) throws HandlerException {
    InvocableHandler handler = handlers.get(handlerRef);
    if (handler == null) {
      throw new HandlerNotFoundException(handlerRef, "No handler registered for " + handlerRef);
    }
    return handler;
  }
}
