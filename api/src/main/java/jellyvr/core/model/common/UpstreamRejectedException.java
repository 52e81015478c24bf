package jellyvr.core.model.common;

/**
 * Jellyfin answered with a status the gateway has no mapping for.
 */
public class UpstreamRejectedException extends RuntimeException {

    private final int statusCode;

    public UpstreamRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
