package io.sqsoffline.invoke;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Resolved handlers keyed by handler reference, shared by every polling loop.
 *
 * <p>Unless {@code skipCacheInvalidation} is set, the cached entry (and whatever the loader
 * cached) is discarded before each load, so every invocation runs the current code.
 * With it set, the first resolved handler is reused.
 */
public final class HandlerCache {
  private static final Logger logger = Logger.getLogger(HandlerCache.class.getName());

  private final HandlerLoader loader;
  private final boolean skipCacheInvalidation;
  private final ConcurrentHashMap<String, InvocableHandler> handlers = new ConcurrentHashMap<>();

  public HandlerCache(HandlerLoader loader, boolean skipCacheInvalidation) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.skipCacheInvalidation = skipCacheInvalidation;
  }

  /**
   * Returns the handler for {@code handlerRef}, loading it when not cached.
   *
   * @throws HandlerException if the loader cannot resolve it
   */
  public InvocableHandler load(String handlerRef) throws HandlerException {
    if (!skipCacheInvalidation) {
      invalidate(handlerRef);
    }
    InvocableHandler cached = handlers.get(handlerRef);
    if (cached != null) {
      return cached;
    }
    InvocableHandler loaded = loader.resolve(handlerRef);
    if (skipCacheInvalidation) {
      InvocableHandler existing = handlers.putIfAbsent(handlerRef, loaded);
      return existing != null ? existing : loaded;
    }
    return loaded;
  }

  public void invalidate(String handlerRef) {
    if (handlers.remove(handlerRef) != null) {
      logger.fine(() -> "Invalidated cached handler " + handlerRef);
    }
    loader.invalidate(handlerRef);
  }

  public boolean isCached(String handlerRef) {
    return handlers.containsKey(handlerRef);
  }

  public void clear() {
    for (String handlerRef : handlers.keySet()) {
      invalidate(handlerRef);
    }
  }

  public boolean skipCacheInvalidation() {
    return skipCacheInvalidation;
  }
}
