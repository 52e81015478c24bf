package jellyvr.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for gateway metrics.
 *
 * <p>Example configuration:
 * <pre>{@code
 * jellyvr.telemetry.enabled=true
 * jellyvr.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "jellyvr.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle. When disabled, metrics are not recorded regardless of
     * {@link MetricsConfig#enabled()}.
     */
    @WithDefault("true")
    boolean enabled();

    MetricsConfig metrics();

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
