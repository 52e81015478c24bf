package jellyvr.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * {@link LocalCache} on top of Caffeine, bounded by size and expiring entries
 * a fixed time after they were written.
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, Ticker.systemTicker());
    }

    /**
     * @param ttl     lifetime of an entry after its last write; zero disables caching
     * @param maxSize entries kept before the least valuable are evicted
     * @param ticker  time source, replaceable in tests
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, Ticker ticker) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Library cache TTL cannot be negative: " + ttl);
        }
        if (maxSize < 0) {
            throw new IllegalArgumentException("Library cache size cannot be negative: " + maxSize);
        }
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidateIf(Predicate<K> keys) {
        cache.asMap().keySet().removeIf(keys);
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
