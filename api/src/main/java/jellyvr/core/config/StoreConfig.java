package jellyvr.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the persistent store.
 *
 * <p>Configuration prefix: {@code jellyvr.store}
 */
@ConfigMapping(prefix = "jellyvr.store")
public interface StoreConfig {

    /**
     * Storage provider name.
     *
     * <p>Available providers: file, memory, redis. Startup fails when the
     * selected provider is unknown or unavailable.
     *
     * @return provider name (default: file)
     */
    @WithDefault("file")
    String provider();

    /**
     * Timeout for a single store operation.
     *
     * @return operation timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration timeout();

    /**
     * Attempts of a read-modify-write cycle before giving up on contention.
     *
     * @return attempts (default: 8)
     */
    @WithDefault("8")
    int maxSwapAttempts();

    FileConfig file();

    RedisConfig redis();

    /**
     * File provider options.
     */
    interface FileConfig {

        /**
         * Directory holding one file per record.
         *
         * @return data directory (default: data)
         */
        @WithDefault("data")
        String directory();
    }

    /**
     * Redis provider options.
     */
    interface RedisConfig {

        /**
         * Prefix prepended to every Redis key.
         *
         * @return key prefix (default: jellyvr:)
         */
        @WithDefault("jellyvr:")
        String keyPrefix();
    }
}
