package jellyvr.core.service.store;

import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.core.config.StoreConfig;
import jellyvr.core.model.common.StoreUnavailableException;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.model.store.StoreUpdate;
import jellyvr.core.model.store.Versioned;
import jellyvr.core.port.out.KeyValueStore;

/**
 * Typed access to the key/value store.
 *
 * <p>Records are stored as JSON. Conditional writes compare against the exact
 * text that was read, so a record is only replaced if nobody wrote it in between.
 */
@ApplicationScoped
public class RecordStore {

    private static final Logger LOG = Logger.getLogger(RecordStore.class);

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final int maxSwapAttempts;

    @Inject
    public RecordStore(KeyValueStore store, ObjectMapper objectMapper, StoreConfig config) {
        this(store, objectMapper, config.maxSwapAttempts());
    }

    public RecordStore(KeyValueStore store, ObjectMapper objectMapper, int maxSwapAttempts) {
        if (maxSwapAttempts < 1) {
            throw new IllegalArgumentException("maxSwapAttempts must be at least 1");
        }
        this.store = store;
        this.maxSwapAttempts = maxSwapAttempts;
        this.mapper = objectMapper
                .copy()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Read and decode a record.
     *
     * @param key record key
     * @param type record type
     * @return the record, or empty if absent
     */
    public <T> Uni<Optional<T>> find(StoreKey key, Class<T> type) {
        return read(key, type).map(found -> found.map(Versioned::value));
    }

    /**
     * Read a record along with its stored text, for a later {@link #swap}.
     *
     * @param key record key
     * @param type record type
     * @return the versioned record, or empty if absent
     */
    public <T> Uni<Optional<Versioned<T>>> read(StoreKey key, Class<T> type) {
        return store.get(key).map(raw -> raw.map(text -> new Versioned<>(decode(key, text, type), text)));
    }

    /**
     * Store a record only if the key is free.
     *
     * @return true if inserted, false if a record already exists
     */
    public <T> Uni<Boolean> insertIfAbsent(StoreKey key, T value) {
        return Uni.createFrom()
                .item(() -> encode(key, value))
                .flatMap(text -> store.compareAndSwap(key, Optional.empty(), text));
    }

    /**
     * Store a record unconditionally.
     */
    public <T> Uni<Void> save(StoreKey key, T value) {
        return Uni.createFrom().item(() -> encode(key, value)).flatMap(text -> store.put(key, text));
    }

    public Uni<Void> remove(StoreKey key) {
        return store.delete(key);
    }

    /**
     * Replace a record only if it is still the version that was read.
     *
     * @param key record key
     * @param expected version previously read, or empty to require absence
     * @param value new record
     * @return true if applied, false if another writer changed the record
     */
    public <T> Uni<Boolean> swap(StoreKey key, Optional<Versioned<T>> expected, T value) {
        return Uni.createFrom()
                .item(() -> encode(key, value))
                .flatMap(text -> store.compareAndSwap(key, expected.map(Versioned::raw), text));
    }

    /**
     * Read-modify-write a record.
     *
     * <p>{@code update} receives the current record and returns the record to
     * store, or empty to leave the store untouched. On a concurrent write the
     * cycle is repeated with the fresh record, at most {@code maxSwapAttempts}
     * times. {@code update} must therefore be free of side effects.
     *
     * @param key record key
     * @param type record type
     * @param update computes the new record from the current one
     * @return previous and current record, and whether a write happened
     * @throws StoreUnavailableException if the record stayed contended for every attempt
     */
    public <T> Uni<StoreUpdate<T>> modify(StoreKey key, Class<T> type, Function<Optional<T>, Optional<T>> update) {
        return modify(key, type, update, 1);
    }

    private <T> Uni<StoreUpdate<T>> modify(
            StoreKey key, Class<T> type, Function<Optional<T>, Optional<T>> update, int attempt) {
        return read(key, type).flatMap(current -> {
            Optional<T> previous = current.map(Versioned::value);
            Optional<T> next = update.apply(previous);
            if (next.isEmpty()) {
                return Uni.createFrom().item(StoreUpdate.unchanged(previous));
            }
            return swap(key, current, next.get()).flatMap(applied -> {
                if (applied) {
                    return Uni.createFrom().item(StoreUpdate.written(previous, next.get()));
                }
                if (attempt >= maxSwapAttempts) {
                    LOG.warnf("Giving up on %s after %d conflicting writes", key, attempt);
                    return Uni.createFrom()
                            .<StoreUpdate<T>>failure(new StoreUnavailableException(
                                    "compareAndSwap", "Record " + key + " is contended, try again later"));
                }
                LOG.debugf("Conflict updating %s (attempt %d), re-reading", key, attempt);
                return modify(key, type, update, attempt + 1);
            });
        });
    }

    private <T> String encode(StoreKey key, T value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize record for " + key, e);
        }
    }

    private <T> T decode(StoreKey key, String text, Class<T> type) {
        try {
            return mapper.readValue(text, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StoreUnavailableException("decode", "Stored record " + key + " is unreadable", e);
        }
    }
}
