package io.sqsoffline.invoke;

import io.sqsoffline.util.QueueArns;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * Execution context handed to a handler alongside the event.
 *
 * <p>Exposes the function identity, a unique invocation id, the remaining time before the
 * deadline, and three completion signals. Signals settle the invocation only if nothing
 * else has settled it first.
 */
public final class InvocationContext {
  public static final String FUNCTION_VERSION = "$LATEST";
  public static final String MEMORY_LIMIT_IN_MB = "1024";

  private static final DateTimeFormatter LOG_STREAM_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

  private final String awsRequestId;
  private final String functionName;
  private final String invokedFunctionArn;
  private final String logGroupName;
  private final String logStreamName;
  private final long startNanos;
  private final long timeoutMillis;
  private final CompletionLatch latch;

  InvocationContext(String functionName, Duration timeout, String region, String accountId, CompletionLatch latch) {
    this.functionName = Objects.requireNonNull(functionName, "functionName");
    this.latch = Objects.requireNonNull(latch, "latch");
    this.timeoutMillis = timeout.toMillis();
    this.startNanos = System.nanoTime();
    this.awsRequestId = UUID.randomUUID().toString();
    this.invokedFunctionArn = QueueArns.functionArn(region, accountId, functionName);
    this.logGroupName = "/aws/lambda/" + functionName;
    this.logStreamName = LocalDate.now(ZoneOffset.UTC).format(LOG_STREAM_DATE)
        + "/[" + FUNCTION_VERSION + "]" + UUID.randomUUID().toString().replace("-", "");
  }

  public String awsRequestId() {
    return awsRequestId;
  }

  /**
   * @return the handler reference being invoked
   */
  public String functionName() {
    return functionName;
  }

  public String functionVersion() {
    return FUNCTION_VERSION;
  }

  public String invokedFunctionArn() {
    return invokedFunctionArn;
  }

  public String memoryLimitInMB() {
    return MEMORY_LIMIT_IN_MB;
  }

  public String logGroupName() {
    return logGroupName;
  }

  public String logStreamName() {
    return logStreamName;
  }

  /**
   * Returns the time left before the deadline. Decreases monotonically and never goes below 0.
   *
   * @return remaining milliseconds
   */
  public long getRemainingTimeInMillis() {
    long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000L;
    return Math.max(0L, timeoutMillis - elapsedMillis);
  }

  /**
   * Reports completion: failure when {@code error} is non-null, success otherwise.
   */
  public void done(Throwable error, Object result) {
    latch.complete(error, result);
  }

  public void succeed(Object result) {
    latch.complete(null, result);
  }

  public void fail(Throwable error) {
    latch.complete(Objects.requireNonNull(error, "error"), null);
  }
}
