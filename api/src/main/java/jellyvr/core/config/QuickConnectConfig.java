package jellyvr.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for browser login through Jellyfin QuickConnect.
 *
 * <p>Configuration prefix: {@code jellyvr.quick-connect}
 */
@ConfigMapping(prefix = "jellyvr.quick-connect")
public interface QuickConnectConfig {

    /**
     * How long a QuickConnect code stays valid.
     *
     * <p>A request not approved within this window expires, and an approval
     * observed afterwards is ignored.
     *
     * @return authorization window (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration timeout();

    /**
     * Timeout applied to a single upstream poll.
     *
     * @return poll timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration pollTimeout();

    /**
     * Retries of a poll that failed because Jellyfin was unavailable.
     *
     * @return retry count (default: 2)
     */
    @WithDefault("2")
    int pollRetries();

    /**
     * Initial backoff between poll retries.
     *
     * @return initial backoff (default: 200 milliseconds)
     */
    @WithDefault("PT0.2S")
    Duration pollBackoff();

    /**
     * Length of the generated local password.
     *
     * <p>Kept short because it is typed on a VR keyboard.
     *
     * @return password length (default: 6)
     */
    @WithDefault("6")
    int passwordLength();
}
