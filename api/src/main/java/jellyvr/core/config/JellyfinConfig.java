package jellyvr.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the upstream Jellyfin server.
 *
 * <p>Configuration prefix: {@code jellyvr.jellyfin}
 */
@ConfigMapping(prefix = "jellyvr.jellyfin")
public interface JellyfinConfig {

    /**
     * Base URL the gateway uses to reach Jellyfin, e.g. {@code http://jellyfin:8096}.
     */
    String baseUrl();

    /**
     * Base URL the VR client uses for media and image links.
     *
     * <p>Useful when Jellyfin is reached on an internal address that the
     * headset cannot resolve. Defaults to {@link #baseUrl()}.
     */
    Optional<String> externalUrl();

    /**
     * Timeout for a single upstream request.
     *
     * @return request timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration requestTimeout();

    /**
     * Items fetched per library page.
     *
     * @return page size (default: 200)
     */
    @WithDefault("200")
    int pageSize();

    /**
     * Device name reported to Jellyfin.
     */
    @WithDefault("JellyVR")
    String deviceName();

    /**
     * Client version reported to Jellyfin.
     */
    @WithDefault("0.1.0")
    String clientVersion();

    default String mediaBaseUrl() {
        return externalUrl().filter(url -> !url.isBlank()).orElse(baseUrl());
    }
}
