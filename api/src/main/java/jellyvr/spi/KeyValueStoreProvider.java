package jellyvr.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import jellyvr.core.port.out.KeyValueStore;

/**
 * SPI for key/value store backends.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>file - one JSON file per record in a local directory (default)</li>
 *   <li>redis - Redis, for deployments that already run one</li>
 *   <li>memory - in-memory storage (tests and development only)</li>
 * </ul>
 *
 * <p>The provider named by {@code jellyvr.store.provider} is used. There is no
 * fallback: if it is missing or unavailable the gateway refuses to start, since
 * silently running on another backend would lose sessions.
 */
public interface KeyValueStoreProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "file", "redis", "memory")
     */
    String name();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the store implementation.
     *
     * @return store instance
     * @throws StorageProviderException if the backend cannot be initialized
     */
    KeyValueStore createStore();

    /**
     * Report the health of this storage backend.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
