package dev.timedqueue.client;

import dev.timedqueue.api.ExpiredEntry;
import dev.timedqueue.config.TimedQueueConfig;
import dev.timedqueue.core.LinkedTimedQueue;
import dev.timedqueue.worker.ExpirationWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes resources that have not been touched for the configured delay.
 *
 * <p><strong>Usage Pattern:</strong>
 * <pre>{@code
 * IdleResourceReaper<String, Connection> reaper =
 *         new IdleResourceReaper<>(new TimedQueueConfig().setDelay(Duration.ofSeconds(30)));
 *
 * reaper.touch("db-main", connection);   // closed 30s after the last touch
 * reaper.release("db-main");             // caller takes the connection back, nothing is closed
 * reaper.close();                        // stops the worker, closes everything still pending
 * }</pre>
 *
 * <p>Touching a key with a different resource replaces the pending one without closing it; the caller
 * owns whatever it swapped out.
 *
 * @param <K> resource key
 * @param <R> resource type
 */
public class IdleResourceReaper<K, R extends AutoCloseable> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(IdleResourceReaper.class);

    private final LinkedTimedQueue<K, R> queue;
    private final ExpirationWorker<K, R> worker;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // orders touch() against the closed transition so nothing is queued after the final drain
    private final Object lifecycleLock = new Object();

    public IdleResourceReaper(TimedQueueConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.queue = new LinkedTimedQueue<>(config);
        this.worker = new ExpirationWorker<>(queue, this::closeResource, config).start();
    }

    /**
     * Schedules {@code resource} to be closed once {@code key} has been idle for the configured delay,
     * restarting the countdown if the key is already pending.
     *
     * @throws IllegalStateException if the reaper is closed
     */
    public void touch(K key, R resource) {
        synchronized (lifecycleLock) {
            if (closed.get()) {
                throw new IllegalStateException("Reaper is closed");
            }
            queue.upsert(key, resource);
        }
    }

    /**
     * Stops tracking {@code key}. The resource is left open.
     */
    public void release(K key) {
        queue.remove(key);
    }

    public boolean isPending(K key) {
        return queue.contains(key);
    }

    public int pendingCount() {
        return queue.size();
    }

    public long reapedCount() {
        return worker.deliveredCount();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void closeResource(K key, R resource) {
        try {
            resource.close();
            logger.debug("Closed idle resource '{}'", key);
        } catch (Exception e) {
            logger.warn("Failed to close idle resource '{}': {}", key, e.getMessage(), e);
        }
    }

    /**
     * Stops the worker and closes every resource still pending. Idempotent.
     *
     * <p>Once the closed flag is set no further touch can queue a resource, so the drain below sees
     * everything that was ever accepted. The worker is stopped outside the lock, which lets a handler
     * that touches the reaper fail fast instead of blocking shutdown.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
        }

        worker.close();

        List<ExpiredEntry<K, R>> pending = queue.drain();
        for (ExpiredEntry<K, R> e : pending) {
            closeResource(e.key(), e.payload());
        }
        logger.info("Closed idle resource reaper for queue '{}' ({} pending resources closed on shutdown)",
                queue.getName(), pending.size());
    }
}
