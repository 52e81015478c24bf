package jellyvr.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import jellyvr.core.port.out.KeyValueStore;
import jellyvr.spi.KeyValueStoreProvider;

/**
 * In-memory store provider.
 *
 * <p><strong>Warning:</strong> every session, login and playback position is
 * lost on restart. Only selected explicitly, never as a fallback.
 */
@ApplicationScoped
public class InMemoryStoreProvider implements KeyValueStoreProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryStoreProvider.class);

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryKeyValueStore store;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized KeyValueStore createStore() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Gateway state is in-memory only!");
            LOG.warn("  Sessions and playback positions are lost on restart.");
            LOG.warn("  Use jellyvr.store.provider=file or redis outside of tests.");
            LOG.warn("========================================================================");
        }
        if (store == null) {
            store = new InMemoryKeyValueStore();
        }
        return store;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        InMemoryKeyValueStore current = store;
        return Optional.of(HealthCheckResponse.named("store-memory")
                .up()
                .withData("type", "in-memory")
                .withData("records", current != null ? current.size() : 0)
                .build());
    }
}
