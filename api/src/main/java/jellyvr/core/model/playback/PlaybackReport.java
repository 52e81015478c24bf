package jellyvr.core.model.playback;

import java.time.Instant;
import java.util.Objects;

/**
 * A playback event from the VR client, already converted to Jellyfin units.
 *
 * @param sessionId local session the report belongs to
 * @param itemId Jellyfin item id
 * @param positionTicks playback position
 * @param kind event kind
 * @param reportedAt when the client produced the event
 * @param paused whether the player is paused
 * @param playSessionId Jellyfin play session, may be null
 */
public record PlaybackReport(
        String sessionId,
        String itemId,
        long positionTicks,
        PlaybackEventKind kind,
        Instant reportedAt,
        boolean paused,
        String playSessionId) {

    public PlaybackReport {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reportedAt, "reportedAt");
        if (positionTicks < 0) {
            throw new IllegalArgumentException("positionTicks cannot be negative: " + positionTicks);
        }
    }
}
