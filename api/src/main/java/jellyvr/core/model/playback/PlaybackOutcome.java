package jellyvr.core.model.playback;

/**
 * What happened to a playback report.
 *
 * @param disposition whether the report changed the stored state
 * @param state the stored state after the report was considered
 */
public record PlaybackOutcome(Disposition disposition, PlaybackState state) {

    public enum Disposition {
        /** The report became the stored state and is relayed upstream. */
        APPLIED,
        /** An identical report was already stored. */
        DUPLICATE,
        /** A newer (or higher precedence) state was already stored. */
        STALE
    }

    public boolean applied() {
        return disposition == Disposition.APPLIED;
    }
}
