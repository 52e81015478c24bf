package jellyvr.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import jellyvr.core.port.out.KeyValueStore;
import jellyvr.core.service.store.KeyValueStoreRegistry;

/**
 * CDI producer for the key/value store.
 *
 * <p>Delegates to the {@link KeyValueStoreRegistry}, which selects the provider
 * named in configuration.
 *
 * @see jellyvr.spi.KeyValueStoreProvider
 */
@ApplicationScoped
public class KeyValueStoreProducer {

    private final KeyValueStoreRegistry registry;

    @Inject
    public KeyValueStoreProducer(KeyValueStoreRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public KeyValueStore keyValueStore() {
        return registry.getStore();
    }
}
