/**
 * Spring Boot auto-configuration for the local queue emulator.
 *
 * <p>Queues are declared under {@code sqs-offline.queues}; handlers are Spring beans
 * annotated with {@link io.sqsoffline.spring.boot.SqsHandler}. Polling starts once the
 * application context is refreshed. Setting {@code sqs-offline.endpoint} switches the
 * backend from memory to an SQS endpoint such as LocalStack.
 */
package io.sqsoffline.spring.boot;
