package jellyvr.core.model.common;

/**
 * Jellyfin rejected a stored access token (HTTP 401).
 *
 * <p>The owning session is no longer usable and the user has to go through
 * QuickConnect again. Never retried.
 */
public class AuthExpiredException extends RuntimeException {

    public AuthExpiredException(String message) {
        super(message);
    }
}
