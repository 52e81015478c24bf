package jellyvr.core.model.jellyfin;

/**
 * Chapter marker.
 *
 * @param name chapter name, may be null
 * @param startPositionTicks start of the chapter
 */
public record JellyfinChapter(String name, long startPositionTicks) {}
