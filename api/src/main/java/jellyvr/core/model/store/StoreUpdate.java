package jellyvr.core.model.store;

import java.util.Optional;

/**
 * Result of a read-modify-write cycle.
 *
 * @param previous record before the update, if any
 * @param current record after the update, if any
 * @param written whether a new value was written
 */
public record StoreUpdate<T>(Optional<T> previous, Optional<T> current, boolean written) {

    public static <T> StoreUpdate<T> unchanged(Optional<T> current) {
        return new StoreUpdate<>(current, current, false);
    }

    public static <T> StoreUpdate<T> written(Optional<T> previous, T current) {
        return new StoreUpdate<>(previous, Optional.of(current), true);
    }
}
