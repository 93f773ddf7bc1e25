package io.sqsoffline.provision;

import io.sqsoffline.model.QueueHandle;
import io.sqsoffline.spi.QueueClient;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe cache of resolved queue handles, keyed by queue name.
 *
 * <p>Filled by {@link QueueProvisioner}; the delivery engine resolves through it and falls
 * back to {@link QueueClient#getQueueInfo} for queues it has not seen.
 */
public final class QueueRegistry {
    private final ConcurrentHashMap<String, QueueHandle> handles = new ConcurrentHashMap<>();

    public void register(QueueHandle handle) {
        Objects.requireNonNull(handle, "handle");
        handles.put(handle.name(), handle);
    }

    /**
     * @param name queue name
     * @return the cached handle, or {@code null}
     */
    public QueueHandle get(String name) {
        return handles.get(name);
    }

    /**
     * Returns the cached handle, or resolves it with {@code client} and caches the result.
     *
     * @param name   queue name
     * @param client client used on a cache miss
     * @return the handle
     * @throws io.sqsoffline.spi.QueueOperationException if the lookup fails
     */
    public QueueHandle resolve(String name, QueueClient client) {
        QueueHandle cached = handles.get(name);
        if (cached != null) {
            return cached;
        }
        QueueHandle resolved = client.getQueueInfo(name);
        QueueHandle existing = handles.putIfAbsent(name, resolved);
        return existing != null ? existing : resolved;
    }

    public void remove(String name) {
        handles.remove(name);
    }

    public Map<String, QueueHandle> snapshot() {
        return Map.copyOf(handles);
    }

    public void clear() {
        handles.clear();
    }
}
