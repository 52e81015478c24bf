package jellyvr.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import jellyvr.core.service.store.KeyValueStoreRegistry;

/**
 * Readiness of the selected key/value store, as reported by its provider.
 *
 * <p>Sessions and login state live only in the store, so the gateway is not
 * ready without it.
 */
@Readiness
@ApplicationScoped
public class StoreHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(StoreHealthCheck.class);
    static final String NAME = "store";

    private final KeyValueStoreRegistry registry;

    @Inject
    public StoreHealthCheck(KeyValueStoreRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            final var provider = registry.getSelectedProvider();
            return provider.healthCheck()
                    .orElseGet(() -> HealthCheckResponse.named(NAME)
                            .up()
                            .withData("provider", provider.name())
                            .build());
        } catch (RuntimeException e) {
            LOG.warnv("Store health check failed: {0}", e.getMessage());
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", e.getClass().getSimpleName())
                    .build();
        }
    }
}
