package jellyvr.core.model.playback;

import java.time.Instant;
import java.util.Comparator;

/**
 * Last known playback position of one item in one session.
 *
 * <p>The state is entirely derived from the winning report: reports are merged
 * last-writer-wins on {@code lastReportedAt}, and reports carrying the same
 * timestamp are ordered by {@link #PRECEDENCE} so the surviving state does not
 * depend on arrival order.
 */
public record PlaybackState(
        String sessionId,
        String itemId,
        long positionTicks,
        boolean watched,
        Instant lastReportedAt,
        boolean paused,
        String playSessionId,
        PlaybackEventKind lastEvent) {

    /** Total order used to merge states; the greater state wins. */
    public static final Comparator<PlaybackState> PRECEDENCE = Comparator.comparing(PlaybackState::lastReportedAt)
            .thenComparingLong(PlaybackState::positionTicks)
            .thenComparing(PlaybackState::watched)
            .thenComparing(PlaybackState::lastEvent)
            .thenComparing(PlaybackState::paused)
            .thenComparing(PlaybackState::playSessionId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static PlaybackState from(PlaybackReport report) {
        return new PlaybackState(
                report.sessionId(),
                report.itemId(),
                report.positionTicks(),
                report.kind() == PlaybackEventKind.WATCHED,
                report.reportedAt(),
                report.paused(),
                report.playSessionId(),
                report.kind());
    }

    /**
     * Whether this state should replace {@code current}.
     */
    public boolean supersedes(PlaybackState current) {
        return current == null || PRECEDENCE.compare(this, current) > 0;
    }
}
