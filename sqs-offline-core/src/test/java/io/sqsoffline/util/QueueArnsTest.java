package io.sqsoffline.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QueueArnsTest {

    @Test
    void buildsQueueArn() {
        assertEquals("arn:aws:sqs:us-east-1:000000000000:orders",
                QueueArns.queueArn("us-east-1", QueueArns.DEFAULT_ACCOUNT_ID, "orders"));
    }

    @Test
    void buildsFunctionArn() {
        assertEquals("arn:aws:lambda:eu-west-1:123:function:orders.process",
                QueueArns.functionArn("eu-west-1", "123", "orders.process"));
    }

    @Test
    void resourceNameIsLastSegment() {
        assertEquals("test-dlq", QueueArns.resourceName("arn:aws:sqs:us-east-1:123456789012:test-dlq"));
        assertEquals("plain", QueueArns.resourceName("plain"));
    }
}
