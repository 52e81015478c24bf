package jellyvr.adapter.out.storage.redis;

import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.adapter.out.storage.StoreTimeoutHelper;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.out.KeyValueStore;

/**
 * Redis implementation of KeyValueStore.
 *
 * <p>Records are plain string values under {@code <prefix><entity>:<id>}.
 * Compare-and-swap runs as a Lua script so Redis applies the comparison and the
 * write atomically. Durability follows the Redis persistence settings.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(RedisKeyValueStore.class);

    static final String COMPARE_AND_SWAP_SCRIPT = "local current = redis.call('GET', KEYS[1])\n"
            + "if ARGV[1] == 'absent' then\n"
            + "  if current then return 0 end\n"
            + "elseif current ~= ARGV[2] then\n"
            + "  return 0\n"
            + "end\n"
            + "redis.call('SET', KEYS[1], ARGV[3])\n"
            + "return 1\n";

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final StoreTimeoutHelper timeoutHelper;

    public RedisKeyValueStore(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, StoreTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Optional<String>> get(StoreKey key) {
        var operation = valueCommands.get(redisKey(key)).map(Optional::ofNullable);
        return timeoutHelper.withTimeout(operation, "get");
    }

    @Override
    public Uni<Void> put(StoreKey key, String value) {
        return timeoutHelper.withTimeout(valueCommands.set(redisKey(key), value), "put");
    }

    @Override
    public Uni<Void> delete(StoreKey key) {
        return timeoutHelper.withTimeout(keyCommands.del(redisKey(key)).replaceWithVoid(), "delete");
    }

    @Override
    public Uni<Boolean> compareAndSwap(StoreKey key, Optional<String> expected, String newValue) {
        String mode = expected.isPresent() ? "expected" : "absent";
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        COMPARE_AND_SWAP_SCRIPT,
                        "1",
                        redisKey(key),
                        mode,
                        expected.orElse(""),
                        newValue)
                .map(response -> {
                    boolean applied = response != null && response.toInteger() == 1;
                    if (!applied) {
                        LOG.debugf("Compare-and-swap conflict in Redis: %s", key);
                    }
                    return applied;
                });
        return timeoutHelper.withTimeout(operation, "compareAndSwap");
    }

    String redisKey(StoreKey key) {
        return keyPrefix + key;
    }
}
