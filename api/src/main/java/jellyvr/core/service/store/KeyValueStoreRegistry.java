package jellyvr.core.service.store;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import jellyvr.core.config.StoreConfig;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.port.out.KeyValueStore;
import jellyvr.spi.KeyValueStoreProvider;
import jellyvr.spi.StorageProviderException;

/**
 * Registry for key/value store providers.
 *
 * <p>Discovers providers via CDI and selects the one named by
 * {@code jellyvr.store.provider}. Selection fails instead of falling back to
 * another provider when the configured one is unknown or unavailable.
 */
@ApplicationScoped
public class KeyValueStoreRegistry {

    private static final Logger LOG = Logger.getLogger(KeyValueStoreRegistry.class);

    private final Instance<KeyValueStoreProvider> providers;
    private final StoreConfig config;
    private final GatewayMetrics metrics;

    private volatile KeyValueStoreProvider selectedProvider;
    private volatile KeyValueStore store;

    @Inject
    public KeyValueStoreRegistry(
            Instance<KeyValueStoreProvider> providers, StoreConfig config, GatewayMetrics metrics) {
        this.providers = providers;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Select the provider during startup, on a worker thread, so a
     * misconfiguration stops the application before it serves requests.
     */
    void onStart(@Observes StartupEvent event) {
        getStore();
        LOG.infof("Key/value store provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the store from the selected provider.
     *
     * @return store instance
     * @throws StorageProviderException if the configured provider cannot be used
     */
    public synchronized KeyValueStore getStore() {
        if (store == null) {
            store = new MeteredKeyValueStore(getSelectedProvider().createStore(), metrics);
        }
        return store;
    }

    /**
     * Get the selected storage provider.
     *
     * @return selected provider
     */
    public synchronized KeyValueStoreProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private KeyValueStoreProvider selectProvider() {
        String configured = config.provider();
        List<KeyValueStoreProvider> named = providers.stream()
                .filter(p -> p.name().equals(configured))
                .toList();

        if (named.isEmpty()) {
            throw new StorageProviderException(
                    configured,
                    "Unknown store provider '" + configured + "', known providers: "
                            + providers.stream().map(KeyValueStoreProvider::name).toList());
        }
        if (named.size() > 1) {
            throw new StorageProviderException(
                    configured, "More than one store provider is named '" + configured + "'");
        }

        KeyValueStoreProvider provider = named.get(0);
        if (!provider.isAvailable()) {
            throw new StorageProviderException(configured, "Store provider '" + configured + "' is not available");
        }
        LOG.infof("Using configured store provider: %s", configured);
        return provider;
    }
}
