package io.sqsoffline.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("sqs-offline-poller-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("sqs-offline-poller-1", thread.getName());
        assertNotNull(thread.getUncaughtExceptionHandler());
    }

    @Test
    void sequentialNaming() {
        DaemonThreadFactory factory = new DaemonThreadFactory("test-");

        factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("test-2", second.getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
