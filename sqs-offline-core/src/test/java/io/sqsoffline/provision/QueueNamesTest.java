package io.sqsoffline.provision;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueNamesTest {

    @Test
    void sanitizesKnownInputs() {
        assertEquals("wetrained-webhook-events-local-fifo", QueueNames.sanitize("wetrained-webhook-events-local.fifo"));
        assertEquals("queue-with-dots-and-symbols", QueueNames.sanitize("queue.with.dots.and@symbols!"));
        assertEquals("a".repeat(80), QueueNames.sanitize("a".repeat(100)));
        assertEquals("queue-with-trailing-dots", QueueNames.sanitize("queue-with-trailing-dots..."));
        assertEquals("queue", QueueNames.sanitize("@#$%^&*()"));
    }

    @Test
    void fallsBackForNullAndEmpty() {
        assertEquals(QueueNames.FALLBACK_NAME, QueueNames.sanitize(null));
        assertEquals(QueueNames.FALLBACK_NAME, QueueNames.sanitize(""));
    }

    @Test
    void keepsUnderscoresAndLeadingSeparators() {
        assertEquals("my_queue-1", QueueNames.sanitize("my_queue--1"));
        assertEquals("-lead", QueueNames.sanitize("..lead"));
    }

    @Test
    void trimsSeparatorLeftByTruncation() {
        String name = "a".repeat(79) + ".b";

        assertEquals("a".repeat(79), QueueNames.sanitize(name));
    }

    @Test
    void sanitizeIsIdempotentAndProducesValidNames() {
        List<String> inputs = List.of(
                "orders", "wetrained-webhook-events-local.fifo", "queue.with.dots.and@symbols!",
                "a".repeat(100), "x".repeat(79) + "..yz", "@#$%^&*()", "--", "ünïcödé queue", "a-b_c");
        for (String input : inputs) {
            String once = QueueNames.sanitize(input);
            assertEquals(once, QueueNames.sanitize(once), input);
            assertTrue(QueueNames.isValid(once), once);
            assertFalse(once.endsWith("-"), once);
        }
    }
}
