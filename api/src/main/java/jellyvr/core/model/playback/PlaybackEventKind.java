package jellyvr.core.model.playback;

/**
 * Kinds of playback report, ordered so that later lifecycle stages sort higher.
 */
public enum PlaybackEventKind {
    START,
    PROGRESS,
    STOP,
    WATCHED
}
