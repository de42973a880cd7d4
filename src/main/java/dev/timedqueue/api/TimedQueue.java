package dev.timedqueue.api;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Debounced delay queue semantics:
 * - Every entry expires a fixed delay after its most recent {@link #upsert}. The delay is chosen once per
 *   queue instance, so insertion order is also deadline order.
 * - Upserting a key that is already pending discards the old entry and re-inserts it at the newest end
 *   with a fresh deadline.
 * - Expired entries are handed out one at a time, oldest first, by {@link #waitUntilExpired}. A single
 *   consumer thread is expected to call it in a loop.
 *
 * @param <K> key type, must have stable equals/hashCode
 * @param <P> payload type
 */
public interface TimedQueue<K, P> {

    /**
     * Inserts or re-inserts {@code key} with a deadline of now + delay, replacing any pending payload.
     */
    void upsert(K key, P payload);

    /**
     * Removes the pending entry for {@code key}, if any. The handler is never invoked for a removed entry.
     */
    void remove(K key);

    /**
     * Raises the one-shot cancellation flag and wakes a consumer blocked on an empty queue.
     *
     * Note: a consumer that has already observed a pending entry keeps waiting for it and delivers it
     * once it expires. Cancellation only stops the wait on an empty queue.
     */
    void cancel();

    /**
     * Blocks until the oldest entry expires, removes it and invokes {@code handler} with it outside the
     * queue lock.
     *
     * @return true if an entry was delivered, false if the queue was cancelled while empty
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    boolean waitUntilExpired(ExpirationHandler<? super K, ? super P> handler) throws InterruptedException;

    /**
     * Same as {@link #waitUntilExpired(ExpirationHandler)} but returns the entry instead of calling back.
     *
     * @return the expired entry, or empty if the queue was cancelled while empty
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Optional<ExpiredEntry<K, P>> awaitExpired() throws InterruptedException;

    /**
     * Removes every pending entry without waiting for its deadline.
     *
     * @return the removed entries, oldest first
     */
    List<ExpiredEntry<K, P>> drain();

    boolean contains(K key);

    int size();

    boolean isEmpty();

    boolean isCancelled();

    Duration getDelay();
}
