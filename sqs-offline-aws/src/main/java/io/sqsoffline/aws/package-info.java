/**
 * AWS SDK transport for talking to a real SQS endpoint or a local emulator such as LocalStack.
 *
 * <p>{@link io.sqsoffline.aws.SqsQueueClient} implements the {@link io.sqsoffline.spi.QueueClient}
 * SPI on top of {@code software.amazon.awssdk:sqs}.
 *
 * @see io.sqsoffline.aws.SqsQueueClient
 */
package io.sqsoffline.aws;
