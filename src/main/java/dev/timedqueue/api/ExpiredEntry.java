package dev.timedqueue.api;

import java.util.Objects;

/**
 * An entry removed from the queue, either because it expired or because it was drained.
 *
 * @param key     the entry key
 * @param payload the payload from the most recent upsert of the key
 */
public record ExpiredEntry<K, P>(K key, P payload) {
    public ExpiredEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
    }
}
