package dev.timedqueue.api;

/**
 * Callback receiving an entry whose deadline has passed. Invoked without the queue lock held, so it may
 * call back into the queue.
 */
@FunctionalInterface
public interface ExpirationHandler<K, P> {
    void onExpired(K key, P payload);
}
