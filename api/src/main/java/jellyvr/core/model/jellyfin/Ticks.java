package jellyvr.core.model.jellyfin;

/**
 * Jellyfin measures positions and durations in 100ns ticks.
 */
public final class Ticks {

    public static final long PER_MILLISECOND = 10_000L;

    /** Largest millisecond value that still fits in a tick count. */
    public static final long MAX_MILLIS = Long.MAX_VALUE / PER_MILLISECOND;

    private Ticks() {}

    /**
     * @throws ArithmeticException if the result does not fit in a {@code long}
     */
    public static long fromMillis(long millis) {
        return Math.multiplyExact(millis, PER_MILLISECOND);
    }

    public static long toMillis(long ticks) {
        return ticks / PER_MILLISECOND;
    }

    public static double toSeconds(long ticks) {
        return ticks / (PER_MILLISECOND * 1000.0);
    }
}
