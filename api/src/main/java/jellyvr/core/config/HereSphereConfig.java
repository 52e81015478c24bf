package jellyvr.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the HereSphere translation.
 *
 * <p>Configuration prefix: {@code jellyvr.heresphere}
 */
@ConfigMapping(prefix = "jellyvr.heresphere")
public interface HereSphereConfig {

    /**
     * Name of the single library tab.
     */
    @WithDefault("Library")
    String libraryName();

    /**
     * Preferred subtitle language (ISO 639-2). Subtitles in this language are
     * listed first.
     */
    Optional<String> subtitleLanguage();

    /**
     * Distance from the end of a video within which a close event marks it
     * watched.
     *
     * @return watched threshold (default: 2 minutes)
     */
    @WithDefault("PT2M")
    Duration watchedThreshold();

    /**
     * Translated library cache settings.
     */
    CacheConfig cache();

    interface CacheConfig {

        /**
         * How long a translated library is served before Jellyfin is listed again.
         *
         * @return cache TTL (default: 2 minutes)
         */
        @WithDefault("PT2M")
        Duration ttl();

        /**
         * Maximum number of cached libraries (one per user and gateway host).
         */
        @WithDefault("64")
        long maxEntries();
    }
}
