package jellyvr.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import jellyvr.core.model.heresphere.Event;
import jellyvr.core.model.heresphere.Index;
import jellyvr.core.model.heresphere.Request;
import jellyvr.core.model.heresphere.Scan;
import jellyvr.core.model.heresphere.VideoData;
import jellyvr.core.model.playback.PlaybackOutcome;
import jellyvr.core.model.session.Session;

/**
 * Inbound port for the HereSphere web API.
 *
 * <p>{@code gatewayUrl} is the scheme and host the player used to reach the
 * gateway; links back to the gateway are built from it.
 */
public interface HereSphereGateway {

    /**
     * Resolve the caller from an {@code auth-token} header or the credentials in
     * the request body.
     *
     * @param authToken token previously returned by the auth endpoint, if sent
     * @param request request body
     * @return the session, or empty when the caller is not logged in
     */
    Uni<Optional<Session>> resolveSession(Optional<String> authToken, Request request);

    /**
     * @param session caller
     * @param gatewayUrl external base URL of the gateway
     * @return library index
     */
    Uni<Index> index(Session session, String gatewayUrl);

    /**
     * @param session caller
     * @param gatewayUrl external base URL of the gateway
     * @return scan data for every listed video
     */
    Uni<Scan> scan(Session session, String gatewayUrl);

    /**
     * Detail of one video. When {@code needsMediaSource} is set a Jellyfin play
     * session is opened, playback start is reported and the event server URL is
     * included.
     *
     * @param session caller
     * @param gatewayUrl external base URL of the gateway
     * @param itemId Jellyfin item id
     * @param needsMediaSource whether the player is about to play the video
     * @return video detail
     */
    Uni<VideoData> video(Session session, String gatewayUrl, String itemId, boolean needsMediaSource);

    /**
     * Apply a playback event posted by the player.
     *
     * @param session caller
     * @param itemId Jellyfin item id
     * @param event playback event
     * @return what happened to the resulting report
     */
    Uni<PlaybackOutcome> event(Session session, String itemId, Event event);
}
