package jellyvr.core.model.common;

/**
 * Jellyfin could not be reached, timed out, or answered with a 5xx status.
 *
 * <p>Transient: the orchestrating caller may retry with bounded backoff.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final int statusCode;

    public UpstreamUnavailableException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /** Returns the upstream HTTP status, or 0 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
