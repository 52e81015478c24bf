package jellyvr.core.cache;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Process-local cache for derived data that can always be rebuilt from
 * Jellyfin, such as translated libraries. Entries expire after a fixed time
 * since they were written; nothing in here is authoritative.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /** Empty when the key was never cached, was dropped, or has expired. */
    Optional<V> get(K key);

    /** Stores or replaces the entry and restarts its expiry. */
    void put(K key, V value);

    /**
     * Drops every entry whose key matches, for example all entries of a user
     * whose Jellyfin token stopped working.
     */
    void invalidateIf(Predicate<K> keys);

    long estimatedSize();
}
