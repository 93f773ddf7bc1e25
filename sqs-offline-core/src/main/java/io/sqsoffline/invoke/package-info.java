/**
 * Handler loading and invocation.
 *
 * <h2>Handlers</h2>
 * <p>A handler is referenced as {@code <module>.<export>}. Two completion protocols are
 * supported:
 * <ul>
 *   <li>{@link io.sqsoffline.invoke.QueueHandler} completes by returning a value, or a
 *       {@link java.util.concurrent.CompletionStage} that completes later</li>
 *   <li>{@link io.sqsoffline.invoke.CallbackQueueHandler} completes through its
 *       {@link io.sqsoffline.invoke.Callback}</li>
 * </ul>
 * Both can also settle through {@code done}, {@code succeed} or {@code fail} on the
 * {@link io.sqsoffline.invoke.InvocationContext}. Whichever report comes first wins.
 *
 * <h2>Loading</h2>
 * <p>{@link io.sqsoffline.invoke.HandlerLoader} implementations resolve references:
 * {@link io.sqsoffline.invoke.DefaultHandlerRegistry} for in-process handlers,
 * {@link io.sqsoffline.invoke.ClassDirectoryHandlerLoader} for classes reloaded from disk.
 * {@link io.sqsoffline.invoke.HandlerCache} invalidates before every load unless
 * {@code skipCacheInvalidation} is set.
 *
 * <h2>Outcomes</h2>
 * <p>{@link io.sqsoffline.invoke.HandlerInvoker#invoke} always yields an
 * {@link io.sqsoffline.invoke.InvocationOutcome}: a thrown exception, a reported error,
 * a load error ({@link io.sqsoffline.invoke.HandlerNotFoundException},
 * {@link io.sqsoffline.invoke.HandlerNotCallableException}) or the deadline
 * ({@link io.sqsoffline.invoke.HandlerTimeoutException}) each become a
 * {@link io.sqsoffline.invoke.InvocationOutcome.Failure}.
 */
package io.sqsoffline.invoke;
