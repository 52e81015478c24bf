package jellyvr.core.service.store;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.port.out.KeyValueStore;

/**
 * Counts failed store operations per operation name.
 */
final class MeteredKeyValueStore implements KeyValueStore {

    private final KeyValueStore delegate;
    private final GatewayMetrics metrics;

    MeteredKeyValueStore(KeyValueStore delegate, GatewayMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public Uni<Optional<String>> get(StoreKey key) {
        return metered("get", delegate.get(key));
    }

    @Override
    public Uni<Void> put(StoreKey key, String value) {
        return metered("put", delegate.put(key, value));
    }

    @Override
    public Uni<Void> delete(StoreKey key) {
        return metered("delete", delegate.delete(key));
    }

    @Override
    public Uni<Boolean> compareAndSwap(StoreKey key, Optional<String> expected, String newValue) {
        return metered("compareAndSwap", delegate.compareAndSwap(key, expected, newValue));
    }

    private <T> Uni<T> metered(String operation, Uni<T> uni) {
        return uni.onFailure().invoke(() -> metrics.recordStoreFailure(operation));
    }
}
