package jellyvr.core.port.out;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import jellyvr.core.model.jellyfin.JellyfinItem;
import jellyvr.core.model.jellyfin.JellyfinUser;
import jellyvr.core.model.jellyfin.PlaybackInfo;
import jellyvr.core.model.jellyfin.ProgressReport;
import jellyvr.core.model.jellyfin.QuickConnectInitiation;
import jellyvr.core.model.jellyfin.QuickConnectStatus;

/**
 * Outbound port for the subset of the Jellyfin REST API the gateway needs.
 *
 * <p>Implementations are stateless and never retry. Failures surface as:
 * <ul>
 *   <li>{@link jellyvr.core.model.common.AuthExpiredException} when Jellyfin rejects the token</li>
 *   <li>{@link jellyvr.core.model.common.UpstreamUnavailableException} on 5xx, connect failures and timeouts</li>
 *   <li>{@link jellyvr.core.model.common.UpstreamRejectedException} on any other unexpected status</li>
 * </ul>
 */
public interface JellyfinUpstream {

    /**
     * Start a QuickConnect request.
     *
     * @return secret and display code
     */
    Uni<QuickConnectInitiation> quickConnectInitiate();

    /**
     * Poll a QuickConnect request once. When the user approved it, the token is
     * exchanged for the given device before returning.
     *
     * @param secret QuickConnect secret
     * @param deviceId device id the access token will be bound to
     * @return pending, approved (with user and token) or rejected
     */
    Uni<QuickConnectStatus> quickConnectPoll(String secret, String deviceId);

    /**
     * Every playable movie and episode visible to the user, paginated lazily.
     *
     * @param user caller
     * @return finite stream of items
     */
    Multi<JellyfinItem> listLibrary(JellyfinUser user);

    /**
     * A single item with media sources.
     *
     * @param user caller
     * @param itemId item id
     * @return the item
     */
    Uni<JellyfinItem> getItem(JellyfinUser user, String itemId);

    /**
     * Open a play session for an item.
     *
     * @param user caller
     * @param itemId item id
     * @return play session and negotiated sources
     */
    Uni<PlaybackInfo> playbackInfo(JellyfinUser user, String itemId);

    /**
     * Relay playback progress.
     *
     * @param user caller
     * @param report progress to relay
     * @return Uni completing once Jellyfin accepted the report
     */
    Uni<Void> reportProgress(JellyfinUser user, ProgressReport report);

    /**
     * Declare what the gateway can play so the session shows up in Jellyfin's
     * dashboard.
     *
     * @param user caller
     * @return Uni completing once reported
     */
    Uni<Void> reportCapabilities(JellyfinUser user);

    /**
     * Revoke the user's access token.
     *
     * @param user caller
     * @return Uni completing once revoked
     */
    Uni<Void> logout(JellyfinUser user);
}
