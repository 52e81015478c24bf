package jellyvr.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import jellyvr.adapter.out.storage.StoreTimeoutHelper;
import jellyvr.core.config.StoreConfig;
import jellyvr.core.port.out.KeyValueStore;
import jellyvr.spi.KeyValueStoreProvider;

/**
 * Redis-based store provider.
 *
 * <p>The Redis data source is resolved lazily so deployments using another
 * provider never open a Redis connection.
 */
@ApplicationScoped
public class RedisStoreProvider implements KeyValueStoreProvider {

    private static final Logger LOG = Logger.getLogger(RedisStoreProvider.class);
    private static final Duration PING_TIMEOUT = Duration.ofSeconds(5);

    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final StoreConfig config;
    private final AtomicBoolean available = new AtomicBoolean(false);

    private volatile RedisKeyValueStore store;

    @Inject
    public RedisStoreProvider(Instance<ReactiveRedisDataSource> redisDataSource, StoreConfig config) {
        this.redisDataSource = redisDataSource;
        this.config = config;
    }

    @Override
    public String name() {
        return "redis";
    }

    /**
     * Pings Redis. Blocks for up to five seconds, so only call it off the event loop.
     */
    @Override
    public boolean isAvailable() {
        if (!redisDataSource.isResolvable()) {
            return false;
        }
        try {
            redisDataSource.get().execute("PING").await().atMost(PING_TIMEOUT);
            available.set(true);
            LOG.info("Redis store is available");
        } catch (RuntimeException e) {
            available.set(false);
            LOG.warnf("Redis store is not available: %s", e.getMessage());
        }
        return available.get();
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (store == null) {
            store = new RedisKeyValueStore(
                    redisDataSource.get(),
                    config.redis().keyPrefix(),
                    new StoreTimeoutHelper(config.timeout(), name()));
            LOG.infof("Created Redis store with prefix: %s", config.redis().keyPrefix());
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        // Cached availability; the health endpoint must not block on Redis.
        if (available.get()) {
            return Optional.of(HealthCheckResponse.named("store-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", config.redis().keyPrefix())
                    .build());
        }
        return Optional.of(HealthCheckResponse.named("store-redis")
                .down()
                .withData("type", "redis")
                .withData("error", "Redis not available or check not completed")
                .build());
    }
}
