package dev.timedqueue.core;

import dev.timedqueue.api.ExpiredEntry;

import java.util.Objects;

/**
 * Immutable pending entry. A debounce never mutates an entry: the old instance is dropped and a new one
 * is inserted, so a reference captured under the lock stays valid after the lock is released.
 *
 * @param key           entry key
 * @param deadlineNanos {@link System#nanoTime()} value after which the entry is expired
 * @param payload       the payload handed to the expiration handler
 */
record QueueEntry<K, P>(K key, long deadlineNanos, P payload) {
    QueueEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
    }

    boolean isExpiredAt(long nowNanos) {
        // difference form stays correct across nanoTime wrap-around
        return nowNanos - deadlineNanos > 0;
    }

    long remainingNanos(long nowNanos) {
        return deadlineNanos - nowNanos;
    }

    ExpiredEntry<K, P> toExpired() {
        return new ExpiredEntry<>(key, payload);
    }
}
