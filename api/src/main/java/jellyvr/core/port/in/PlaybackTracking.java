package jellyvr.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import jellyvr.core.model.playback.PlaybackOutcome;
import jellyvr.core.model.playback.PlaybackReport;
import jellyvr.core.model.playback.PlaybackState;

/**
 * Inbound port for playback progress.
 */
public interface PlaybackTracking {

    /**
     * Merge a report into the stored state and relay it to Jellyfin when it
     * changed the state.
     *
     * <p>The returned Uni completes once the local state is durable; the relay
     * runs detached and its failure never fails the report.
     *
     * @param report playback report
     * @return what happened to the report
     */
    Uni<PlaybackOutcome> report(PlaybackReport report);

    /**
     * Current state for one item in one session.
     *
     * @param sessionId session identifier
     * @param itemId Jellyfin item id
     * @return the state, or empty if nothing was reported yet
     */
    Uni<Optional<PlaybackState>> state(String sessionId, String itemId);
}
