package io.sqsoffline.invoke;

import io.sqsoffline.config.SqsOfflineConfig;
import io.sqsoffline.event.SqsEvent;
import io.sqsoffline.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads a handler, runs it against an event under a deadline, and reports the outcome.
 *
 * <p>The returned future never completes exceptionally: load errors, thrown exceptions,
 * reported failures and deadline expiry all become {@link InvocationOutcome.Failure}.
 * The first completion report wins (see {@link CompletionLatch}); on expiry the handler
 * thread is interrupted and abandoned.
 *
 * <p>Handlers run on a cached pool of daemon threads named {@code sqs-offline-handler-N}
 * unless an executor is supplied.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class HandlerInvoker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HandlerInvoker.class.getName());

  private final HandlerCache cache;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final Duration defaultTimeout;
  private final String region;
  private final String accountId;

  private HandlerInvoker(Builder builder) {
    HandlerLoader loader = Objects.requireNonNull(builder.loader, "loader");
    SqsOfflineConfig config = builder.config != null ? builder.config : SqsOfflineConfig.defaults();
    this.cache = new HandlerCache(loader, config.skipCacheInvalidation());
    this.defaultTimeout = config.handlerTimeout();
    this.region = config.region();
    this.accountId = config.accountId();
    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownsExecutor = false;
    } else {
      this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("sqs-offline-handler-"));
      this.ownsExecutor = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Invokes with the configured default timeout.
   */
  public CompletableFuture<InvocationOutcome> invoke(String handlerRef, SqsEvent event) {
    return invoke(handlerRef, event, defaultTimeout);
  }

  /**
   * Invokes a handler.
   *
   * @param handlerRef handler reference, {@code <module>.<export>}
   * @param event      the event
   * @param timeout    deadline measured from this call
   * @return the outcome; never completes exceptionally
   */
  public CompletableFuture<InvocationOutcome> invoke(String handlerRef, SqsEvent event, Duration timeout) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(timeout, "timeout");
    long startNanos = System.nanoTime();

    InvocableHandler handler;
    try {
      HandlerRef.parse(handlerRef);
      handler = cache.load(handlerRef);
    } catch (HandlerException e) {
      logger.log(Level.SEVERE, "Failed to load handler " + handlerRef, e);
      return CompletableFuture.completedFuture(new InvocationOutcome.Failure(e, elapsed(startNanos)));
    } catch (RuntimeException | LinkageError e) {
      logger.log(Level.SEVERE, "Failed to load handler " + handlerRef, e);
      HandlerException wrapped = new HandlerNotCallableException(handlerRef, "Failed to load handler " + handlerRef, e);
      return CompletableFuture.completedFuture(new InvocationOutcome.Failure(wrapped, elapsed(startNanos)));
    }

    CompletionLatch latch = new CompletionLatch(handlerRef);
    InvocationContext context = new InvocationContext(handlerRef, timeout, region, accountId, latch);
    Future<?> task;
    try {
      task = executor.submit(() -> run(handlerRef, handler, event, context, latch));
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(new InvocationOutcome.Failure(e, elapsed(startNanos)));
    }

    return latch.future()
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .<InvocationOutcome>handle((value, error) -> {
          Duration duration = elapsed(startNanos);
          if (error == null) {
            return new InvocationOutcome.Success(value, duration);
          }
          Throwable cause = unwrap(error);
          if (cause instanceof TimeoutException) {
            latch.expire();
            task.cancel(true);
            logger.warning("Handler " + handlerRef + " timed out after " + timeout.toMillis() + "ms");
            return new InvocationOutcome.Failure(new HandlerTimeoutException(handlerRef, timeout), duration);
          }
          return new InvocationOutcome.Failure(cause, duration);
        });
  }

  private static void run(String handlerRef, InvocableHandler handler, SqsEvent event,
                          InvocationContext context, CompletionLatch latch) {
    try {
      handler.invoke(event, context, latch);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      latch.complete(e, null);
    } catch (Throwable t) {
      logger.log(Level.FINE, "Handler " + handlerRef + " threw", t);
      latch.complete(t, null);
    }
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  public HandlerCache cache() {
    return cache;
  }

  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  /**
   * Clears the handler cache and, when the executor is owned, shuts it down.
   */
  @Override
  public void close() {
    cache.clear();
    if (ownsExecutor) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link HandlerInvoker}.
   */
  public static final class Builder {
    private HandlerLoader loader;
    private SqsOfflineConfig config;
    private ExecutorService executor;

    private Builder() {
    }

    /**
     * Sets the loader resolving handler references.
     *
     * <p><b>Required.</b>
     *
     * @param loader the handler loader
     * @return this builder
     */
    public Builder loader(HandlerLoader loader) {
      this.loader = loader;
      return this;
    }

    /**
     * Supplies the default timeout, {@code skipCacheInvalidation}, region and account id.
     *
     * <p>Optional. Defaults to {@link SqsOfflineConfig#defaults()}.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(SqsOfflineConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the executor running handlers. A supplied executor is not shut down by
     * {@link HandlerInvoker#close()}.
     *
     * <p>Optional. Defaults to an owned cached daemon pool.
     *
     * @param executor the executor
     * @return this builder
     */
    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public HandlerInvoker build() {
      return new HandlerInvoker(this);
    }
  }
}
