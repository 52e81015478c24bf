package jellyvr.core.model.common;

/**
 * The device-authorization window of a QuickConnect request elapsed, or
 * Jellyfin no longer knows the request. The browser has to restart login.
 */
public class QuickConnectExpiredException extends RuntimeException {

    private final String displayCode;

    public QuickConnectExpiredException(String displayCode) {
        super("QuickConnect code " + displayCode + " expired");
        this.displayCode = displayCode;
    }

    public String getDisplayCode() {
        return displayCode;
    }
}
