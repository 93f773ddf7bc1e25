package io.sqsoffline.invoke;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Settles an invocation on the first completion report; later reports are dropped.
 *
 * <p>Reports come from the context signals, the {@link Callback}, a handler's return value,
 * a deferred {@link java.util.concurrent.CompletionStage}, a thrown exception, or the deadline.
 * Thread-safe.
 */
public final class CompletionLatch implements Callback {
  private static final Logger logger = Logger.getLogger(CompletionLatch.class.getName());

  private final String handlerRef;
  private final CompletableFuture<Object> future = new CompletableFuture<>();
  private final AtomicBoolean settled = new AtomicBoolean();

  public CompletionLatch(String handlerRef) {
    this.handlerRef = handlerRef;
  }

  /**
   * Reports completion. Ignored if the latch is already settled.
   */
  @Override
  public void complete(Throwable error, Object result) {
    settle(error, result);
  }

  /**
   * @return {@code true} if this report settled the latch
   */
  public boolean settle(Throwable error, Object result) {
    if (!settled.compareAndSet(false, true)) {
      logger.fine(() -> "Dropping late completion for " + handlerRef);
      return false;
    }
    boolean applied = error != null ? future.completeExceptionally(error) : future.complete(result);
    if (!applied) {
      logger.fine(() -> "Dropping completion for " + handlerRef + " after deadline");
    }
    return applied;
  }

  /**
   * Marks the latch settled by the deadline so later reports are dropped.
   *
   * @return {@code true} if no report had settled it yet
   */
  boolean expire() {
    return settled.compareAndSet(false, true);
  }

  public boolean isSettled() {
    return settled.get() || future.isDone();
  }

  CompletableFuture<Object> future() {
    return future;
  }
}
