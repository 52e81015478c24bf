package jellyvr.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import jellyvr.config.TelemetryConfigMapping;
import jellyvr.core.port.out.GatewayMetrics;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe to
 * inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code jellyvr.logins.total} - Browser login outcomes</li>
 *   <li>{@code jellyvr.sessions.created.total} - Sessions issued</li>
 *   <li>{@code jellyvr.auth.local.total} - HereSphere credential checks by result</li>
 *   <li>{@code jellyvr.playback.reports.total} - Playback reports by disposition</li>
 *   <li>{@code jellyvr.playback.relays.total} - Relays to Jellyfin by result</li>
 *   <li>{@code jellyvr.store.failures.total} - Store failures by operation</li>
 *   <li>{@code jellyvr.library.items} - Size of translated libraries</li>
 *   <li>{@code jellyvr.library.dropped.total} - Items dropped during translation</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerGatewayMetrics implements GatewayMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerGatewayMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this(registry, config != null && config.enabled() && config.metrics().enabled());
    }

    MicrometerGatewayMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public void recordLogin(String outcome) {
        if (!enabled) {
            return;
        }
        Counter.builder("jellyvr.logins.total")
                .description("Browser logins by terminal outcome")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordSessionCreated() {
        if (!enabled) {
            return;
        }
        Counter.builder("jellyvr.sessions.created.total")
                .description("Sessions issued after QuickConnect approval")
                .register(registry)
                .increment();
    }

    @Override
    public void recordLocalAuthentication(boolean success) {
        if (!enabled) {
            return;
        }
        Counter.builder("jellyvr.auth.local.total")
                .description("HereSphere credential checks")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordPlaybackReport(String disposition) {
        if (!enabled) {
            return;
        }
        Counter.builder("jellyvr.playback.reports.total")
                .description("Playback reports by disposition")
                .tag("disposition", nullSafe(disposition))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRelay(boolean success) {
        if (!enabled) {
            return;
        }
        Counter.builder("jellyvr.playback.relays.total")
                .description("Playback relays to Jellyfin")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String operation) {
        if (!enabled) {
            return;
        }
        Counter.builder("jellyvr.store.failures.total")
                .description("Failed store operations")
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordLibraryTranslated(int items, int droppedItems) {
        if (!enabled) {
            return;
        }
        DistributionSummary.builder("jellyvr.library.items")
                .description("Items in translated HereSphere libraries")
                .register(registry)
                .record(items);
        if (droppedItems > 0) {
            Counter.builder("jellyvr.library.dropped.total")
                    .description("Items dropped because they could not be translated")
                    .register(registry)
                    .increment(droppedItems);
        }
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
