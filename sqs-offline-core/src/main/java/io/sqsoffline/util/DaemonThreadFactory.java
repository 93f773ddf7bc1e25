package io.sqsoffline.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the scheduler, poller and handler pools.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. and are daemon threads,
 * so a running engine never keeps the JVM alive. Exceptions escaping a task are logged
 * instead of being printed to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught exception on " + t.getName(), e));
        return thread;
    }

    /**
     * Returns the prefix applied to every thread name.
     *
     * @return the thread name prefix
     */
    public String prefix() {
        return prefix;
    }
}
