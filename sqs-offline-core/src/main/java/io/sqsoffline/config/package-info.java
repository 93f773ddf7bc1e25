/**
 * Configuration.
 *
 * <p>{@link io.sqsoffline.config.SqsOfflineConfig} carries the global defaults and the list of
 * queues; each {@link io.sqsoffline.config.QueueDescriptor} is resolved against it so that
 * unset per-queue fields inherit the global values.
 *
 * <h2>Definition maps</h2>
 * <p>{@link io.sqsoffline.config.FunctionEventSources} turns a function definition map into
 * queue builders. It is a library-only entry point: callers that already hold a parsed service
 * definition pass its result to {@link io.sqsoffline.config.SqsOfflineConfig.Builder#queues}.
 * Infrastructure resource maps go to {@link io.sqsoffline.SqsOffline.Builder#resources}. The
 * Spring Boot starter binds neither; it configures queues through {@code sqs-offline.queues}.
 * <pre>{@code
 * SqsOfflineConfig config = SqsOfflineConfig.builder()
 *     .queues(FunctionEventSources.extract(functions))
 *     .build();
 * SqsOffline sqs = SqsOffline.builder()
 *     .queueClient(client)
 *     .handlerLoader(loader)
 *     .config(config)
 *     .resources(resources)
 *     .build();
 * }</pre>
 *
 * <h2>Defaults</h2>
 * <table>
 *   <caption>Global defaults</caption>
 *   <tr><th>Setting</th><th>Default</th><th>Range</th></tr>
 *   <tr><td>pollInterval</td><td>1000 ms</td><td>&ge; 100 ms</td></tr>
 *   <tr><td>maxConcurrentPolls</td><td>3</td><td>&ge; 1</td></tr>
 *   <tr><td>visibilityTimeoutSeconds</td><td>30</td><td>0..43200</td></tr>
 *   <tr><td>waitTimeSeconds</td><td>20</td><td>0..20</td></tr>
 *   <tr><td>maxReceiveCount</td><td>3</td><td>&ge; 1</td></tr>
 *   <tr><td>handlerTimeout</td><td>30 s</td><td>1 s..900 s</td></tr>
 *   <tr><td>batchSize</td><td>1</td><td>1..10</td></tr>
 * </table>
 */
package io.sqsoffline.config;
