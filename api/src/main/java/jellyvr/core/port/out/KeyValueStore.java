package jellyvr.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import jellyvr.core.model.store.StoreKey;

/**
 * Outbound port for the durable key/value store holding all gateway state.
 *
 * <p>Values are opaque strings (JSON documents in practice). Every operation is
 * atomic per key; nothing is ordered across keys. Implementations never block
 * the calling event loop and report any I/O failure, timeout or unreadable
 * record as {@link jellyvr.core.model.common.StoreUnavailableException}.
 */
public interface KeyValueStore {

    /**
     * Read a value.
     *
     * @param key record key
     * @return the stored value, or empty if absent
     */
    Uni<Optional<String>> get(StoreKey key);

    /**
     * Write a value unconditionally.
     *
     * @param key record key
     * @param value new value
     * @return Uni completing once the value is durable
     */
    Uni<Void> put(StoreKey key, String value);

    /**
     * Remove a value. Removing an absent key succeeds.
     *
     * @param key record key
     * @return Uni completing once the removal is durable
     */
    Uni<Void> delete(StoreKey key);

    /**
     * Replace the value only if the current value equals {@code expected}.
     *
     * <p>An empty {@code expected} means "insert only if absent". A {@code false}
     * result is the conflict outcome: another writer got there first and the
     * caller should re-read.
     *
     * @param key record key
     * @param expected value the caller last read, or empty for none
     * @param newValue value to store
     * @return true if the swap was applied, false on conflict
     */
    Uni<Boolean> compareAndSwap(StoreKey key, Optional<String> expected, String newValue);
}
