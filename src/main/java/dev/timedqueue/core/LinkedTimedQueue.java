package dev.timedqueue.core;

import dev.timedqueue.api.ExpirationHandler;
import dev.timedqueue.api.ExpiredEntry;
import dev.timedqueue.api.TimedQueue;
import dev.timedqueue.config.TimedQueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory debounced delay queue with one fixed delay for all entries.
 *
 * <p>Pending entries live in a single insertion-ordered {@link LinkedHashMap}: the hash index gives O(1)
 * lookup by key and the linked sequence keeps entries oldest-first. Because every deadline is
 * {@code insertion time + delay} on the monotonic {@link System#nanoTime()} clock, insertion order is
 * deadline order and no sort or heap is needed. A debounce is remove + reinsert at the newest end.
 *
 * <p><strong>Thread Safety:</strong> producers may call {@link #upsert} and {@link #remove} from any
 * thread. {@link #waitUntilExpired} is meant for a single consumer thread; concurrent consumers race for
 * the oldest entry. All index access happens under one monitor, which is never held while sleeping
 * toward a deadline or while running the expiration handler.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * LinkedTimedQueue<String, Handle> queue = new LinkedTimedQueue<>(Duration.ofSeconds(10));
 * queue.upsert("db-1", handle);        // expires 10s from now
 * queue.upsert("db-1", handle);        // touched again, expires 10s from this call
 *
 * // consumer thread
 * while (queue.waitUntilExpired((key, h) -> h.close())) { }
 * }</pre>
 *
 * @param <K> key type
 * @param <P> payload type
 */
public class LinkedTimedQueue<K, P> implements TimedQueue<K, P> {
    private static final Logger logger = LoggerFactory.getLogger(LinkedTimedQueue.class);

    private final String name;
    private final Duration delay;
    private final long delayNanos;
    private final Object lock = new Object();
    private final LinkedHashMap<K, QueueEntry<K, P>> entries = new LinkedHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public LinkedTimedQueue(Duration delay) {
        this(new TimedQueueConfig().setDelay(Objects.requireNonNull(delay, "delay cannot be null")));
    }

    /**
     * Creates a queue from the given configuration.
     *
     * @param config queue configuration, its delay applies to every entry for the queue's lifetime
     * @throws NullPointerException     if config or its delay is null
     * @throws IllegalArgumentException if the delay is negative or too large to express in nanoseconds
     */
    public LinkedTimedQueue(TimedQueueConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.delay = Objects.requireNonNull(config.getDelay(), "delay cannot be null");
        this.name = config.getName() != null ? config.getName() : "timed-queue";

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative: " + delay);
        }
        try {
            this.delayNanos = delay.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("delay too large: " + delay, e);
        }

        logger.info("Created timed queue '{}' with delay {} ms", name, delay.toMillis());
    }

    @Override
    public void upsert(K key, P payload) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");

        synchronized (lock) {
            boolean wasEmpty = entries.isEmpty();
            // remove first so the key moves to the newest end; put() alone keeps its old position
            QueueEntry<K, P> previous = entries.remove(key);
            QueueEntry<K, P> entry = new QueueEntry<>(key, System.nanoTime() + delayNanos, payload);
            entries.put(key, entry);
            if (wasEmpty) {
                lock.notifyAll();
            }

            if (logger.isDebugEnabled()) {
                logger.debug("{} key '{}' in queue '{}' (pending: {})",
                        previous == null ? "Queued" : "Reset", key, name, entries.size());
            }
        }
    }

    @Override
    public void remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");

        synchronized (lock) {
            // no wake-up: removal can only push the next deadline later, and the waiter re-reads after sleeping
            if (entries.remove(key) != null && logger.isDebugEnabled()) {
                logger.debug("Removed key '{}' from queue '{}' (pending: {})", key, name, entries.size());
            }
        }
    }

    @Override
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            logger.debug("Cancel called on already cancelled queue '{}'", name);
            return;
        }
        logger.info("Cancelling timed queue '{}'", name);
        synchronized (lock) {
            lock.notifyAll();
        }
    }

    @Override
    public boolean waitUntilExpired(ExpirationHandler<? super K, ? super P> handler) throws InterruptedException {
        Objects.requireNonNull(handler, "handler cannot be null");

        QueueEntry<K, P> entry = takeExpired();
        if (entry == null) {
            return false;
        }
        // outside the lock: the handler may be slow or call back into this queue
        handler.onExpired(entry.key(), entry.payload());
        return true;
    }

    @Override
    public Optional<ExpiredEntry<K, P>> awaitExpired() throws InterruptedException {
        QueueEntry<K, P> entry = takeExpired();
        return entry == null ? Optional.empty() : Optional.of(entry.toExpired());
    }

    /**
     * Waits for the oldest entry to expire and removes it.
     *
     * @return the expired entry, or null if cancelled while the queue was empty
     */
    private QueueEntry<K, P> takeExpired() throws InterruptedException {
        while (true) {
            long remaining;
            synchronized (lock) {
                while (entries.isEmpty()) {
                    if (cancelled.get()) {
                        logger.debug("Queue '{}' cancelled while empty, no entry delivered", name);
                        return null;
                    }
                    lock.wait();
                }

                // always re-read the head: it may have been removed or replaced while we slept
                QueueEntry<K, P> oldest = entries.values().iterator().next();
                long now = System.nanoTime();
                if (oldest.isExpiredAt(now)) {
                    entries.remove(oldest.key());
                    if (logger.isDebugEnabled()) {
                        logger.debug("Expired key '{}' in queue '{}' ({} ms late, pending: {})", oldest.key(), name,
                                TimeUnit.NANOSECONDS.toMillis(now - oldest.deadlineNanos()), entries.size());
                    }
                    return oldest;
                }
                remaining = oldest.remainingNanos(now);
            }

            logger.trace("Queue '{}' sleeping {} ns until the oldest deadline", name, remaining);
            TimeUnit.NANOSECONDS.sleep(remaining);
        }
    }

    @Override
    public List<ExpiredEntry<K, P>> drain() {
        List<ExpiredEntry<K, P>> drained;
        synchronized (lock) {
            drained = new ArrayList<>(entries.size());
            for (QueueEntry<K, P> e : entries.values()) {
                drained.add(e.toExpired());
            }
            entries.clear();
        }
        if (!drained.isEmpty()) {
            logger.info("Drained {} pending entries from queue '{}'", drained.size(), name);
        }
        return drained;
    }

    @Override
    public boolean contains(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        synchronized (lock) {
            return entries.containsKey(key);
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    @Override
    public boolean isEmpty() {
        synchronized (lock) {
            return entries.isEmpty();
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public Duration getDelay() {
        return delay;
    }

    public String getName() {
        return name;
    }

    /**
     * Verifies that every index entry agrees with its key and that deadlines never decrease from the
     * oldest to the newest end.
     *
     * @throws IllegalStateException on the first violation found
     */
    void checkInvariants() {
        synchronized (lock) {
            Iterator<Map.Entry<K, QueueEntry<K, P>>> it = entries.entrySet().iterator();
            QueueEntry<K, P> previous = null;
            int counted = 0;
            while (it.hasNext()) {
                Map.Entry<K, QueueEntry<K, P>> e = it.next();
                QueueEntry<K, P> current = e.getValue();
                if (!e.getKey().equals(current.key())) {
                    throw new IllegalStateException("Index key " + e.getKey() + " maps to entry for " + current.key());
                }
                if (previous != null && current.deadlineNanos() - previous.deadlineNanos() < 0) {
                    throw new IllegalStateException("Deadline of " + current.key() + " is earlier than " + previous.key());
                }
                previous = current;
                counted++;
            }
            if (counted != entries.size()) {
                throw new IllegalStateException("Sequence length " + counted + " != index size " + entries.size());
            }
        }
    }
}
