package jellyvr.core.util;

/**
 * Formatting helpers for values that must not appear in logs in full.
 */
public final class LogFormat {

    private static final int VISIBLE_CHARS = 8;

    private LogFormat() {}

    /**
     * Shorten a session id or token to a prefix that identifies it in logs
     * without making it usable.
     *
     * @param id value to shorten, may be null
     * @return the first characters followed by an ellipsis, or the value itself if short
     */
    public static String abbreviate(String id) {
        if (id == null) {
            return "null";
        }
        return id.length() <= VISIBLE_CHARS ? id : id.substring(0, VISIBLE_CHARS) + "...";
    }
}
