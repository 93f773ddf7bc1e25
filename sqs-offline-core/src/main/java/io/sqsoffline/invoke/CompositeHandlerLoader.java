package io.sqsoffline.invoke;

import java.util.List;
import java.util.Objects;

/**
 * Tries several loaders in order; the first one that finds the handler wins.
 *
 * <p>A {@link HandlerNotFoundException} moves on to the next loader. Any other
 * {@link HandlerException} is final. If no loader knows the reference, the last
 * {@link HandlerNotFoundException} is rethrown.
 */
public final class CompositeHandlerLoader implements HandlerLoader {
  private final List<HandlerLoader> loaders;

  public CompositeHandlerLoader(List<HandlerLoader> loaders) {
    this.loaders = List.copyOf(Objects.requireNonNull(loaders, "loaders"));
    if (this.loaders.isEmpty()) {
      throw new IllegalArgumentException("loaders must not be empty");
    }
  }

  public CompositeHandlerLoader(HandlerLoader... loaders) {
    this(List.of(loaders));
  }

  @Override
  public InvocableHandler resolve(String handlerRef) throws HandlerException {
    HandlerNotFoundException notFound = null;
    for (HandlerLoader loader : loaders) {
      try {
        return loader.resolve(handlerRef);
      } catch (HandlerNotFoundException e) {
        if (notFound != null) {
          e.addSuppressed(notFound);
        }
        notFound = e;
      }
    }
    throw notFound;
  }

  @Override
  public void invalidate(String handlerRef) {
    for (HandlerLoader loader : loaders) {
      loader.invalidate(handlerRef);
    }
  }
}
