package jellyvr.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the browser cookies used by the login page.
 *
 * <p>Configuration prefix: {@code jellyvr.cookie}
 */
@ConfigMapping(prefix = "jellyvr.cookie")
public interface CookieConfigMapping {

    /**
     * Cookie holding the QuickConnect secret of the login in progress.
     */
    @WithDefault("jellyvr_login")
    String loginName();

    /**
     * Cookie holding the session id once logged in.
     */
    @WithDefault("jellyvr_session")
    String sessionName();

    @WithDefault("/")
    String path();

    Optional<String> domain();

    /**
     * Only send cookies over HTTPS. Off by default since the gateway usually
     * runs on a LAN without TLS.
     */
    @WithDefault("false")
    boolean secure();

    /**
     * SameSite attribute: Strict, Lax or None.
     */
    @WithDefault("Lax")
    String sameSite();

    /**
     * Lifetime of the session cookie.
     *
     * @return max age (default: 400 days)
     */
    @WithDefault("P400D")
    Duration sessionMaxAge();
}
