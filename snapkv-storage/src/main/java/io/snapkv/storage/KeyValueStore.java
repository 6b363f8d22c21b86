package io.snapkv.storage;

import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * String-keyed store holding values of a single type. Implementations are safe for
 * concurrent use without external locking.
 *
 * @param <V> the value type
 */
public interface KeyValueStore<V> {

    /**
     * Returns the current value for {@code key}, or empty if there is none.
     */
    Optional<V> load(String key);

    /**
     * Inserts or overwrites the value for {@code key}. A persistent store has written its
     * full image to disk before this returns.
     */
    void store(String key, V value);

    /**
     * Removes the entry for {@code key}; absent keys are a no-op.
     */
    void delete(String key);

    /**
     * Visits every entry in unspecified order until {@code visitor} returns {@code false}.
     * No entry is visited twice; mutations made during the walk may or may not be seen.
     */
    void range(BiPredicate<String, V> visitor);

    int size();
}
