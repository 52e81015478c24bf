package jellyvr.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.out.KeyValueStore;

/**
 * In-memory implementation of KeyValueStore.
 *
 * <p>Uses ConcurrentHashMap for thread-safe storage. Suitable for development,
 * testing, or single-instance deployments that can afford to lose every session
 * on restart.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<StoreKey, String> records = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<String>> get(StoreKey key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(records.get(key)));
    }

    @Override
    public Uni<Void> put(StoreKey key, String value) {
        return Uni.createFrom().item(() -> {
            records.put(key, value);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(StoreKey key) {
        return Uni.createFrom().item(() -> {
            records.remove(key);
            return null;
        });
    }

    @Override
    public Uni<Boolean> compareAndSwap(StoreKey key, Optional<String> expected, String newValue) {
        return Uni.createFrom().item(() -> expected.map(current -> records.replace(key, current, newValue))
                .orElseGet(() -> records.putIfAbsent(key, newValue) == null));
    }

    /**
     * Get the number of stored records (for monitoring).
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Clear all records (for testing).
     */
    public void clear() {
        records.clear();
    }
}
