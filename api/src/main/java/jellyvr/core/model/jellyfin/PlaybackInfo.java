package jellyvr.core.model.jellyfin;

import java.util.List;

/**
 * Play session opened by Jellyfin for an item.
 *
 * @param playSessionId id to pass on progress reports
 * @param mediaSources sources negotiated for this play session
 */
public record PlaybackInfo(String playSessionId, List<JellyfinMediaSource> mediaSources) {

    public PlaybackInfo {
        mediaSources = mediaSources == null ? List.of() : List.copyOf(mediaSources);
    }
}
