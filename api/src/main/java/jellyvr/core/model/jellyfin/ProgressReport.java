package jellyvr.core.model.jellyfin;

import jellyvr.core.model.playback.PlaybackEventKind;

/**
 * Playback progress relayed to Jellyfin.
 *
 * @param itemId Jellyfin item id
 * @param kind which Jellyfin endpoint the report goes to
 * @param positionTicks current position
 * @param paused whether the player is paused
 * @param playSessionId Jellyfin play session, may be null
 */
public record ProgressReport(
        String itemId, PlaybackEventKind kind, long positionTicks, boolean paused, String playSessionId) {}
