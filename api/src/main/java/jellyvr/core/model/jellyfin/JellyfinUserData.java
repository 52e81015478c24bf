package jellyvr.core.model.jellyfin;

/**
 * Per-user state Jellyfin keeps for an item.
 *
 * @param played whether the item is marked watched
 * @param playbackPositionTicks resume position
 * @param favorite whether the item is a favourite
 */
public record JellyfinUserData(boolean played, long playbackPositionTicks, boolean favorite) {

    public static final JellyfinUserData NONE = new JellyfinUserData(false, 0L, false);
}
