package io.sqsoffline.util;

import java.util.Objects;

/**
 * Builds and takes apart the ARN strings used in redrive policies and event records.
 *
 * <p>The emulated backend uses the simplified form
 * {@code arn:aws:sqs:<region>:<accountId>:<queueName>}.
 */
public final class QueueArns {
    public static final String DEFAULT_ACCOUNT_ID = "000000000000";

    private QueueArns() {}

    public static String queueArn(String region, String accountId, String queueName) {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(queueName, "queueName");
        return "arn:aws:sqs:" + region + ":" + accountId + ":" + queueName;
    }

    public static String functionArn(String region, String accountId, String functionName) {
        return "arn:aws:lambda:" + region + ":" + accountId + ":function:" + functionName;
    }

    /**
     * Returns the trailing segment of an ARN-like string, i.e. the text after the last {@code ':'}.
     * A string without {@code ':'} is returned unchanged.
     *
     * @param arn the ARN
     * @return the resource name segment
     */
    public static String resourceName(String arn) {
        Objects.requireNonNull(arn, "arn");
        int idx = arn.lastIndexOf(':');
        return idx < 0 ? arn : arn.substring(idx + 1);
    }
}
