package jellyvr.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import jellyvr.core.model.session.Session;

/**
 * Inbound port for resolving and invalidating sessions.
 */
public interface SessionManagement {

    /**
     * Check a local username/password pair as typed into the VR client.
     *
     * <p>On success the session's {@code lastUsedAt} is updated.
     *
     * @param username local username
     * @param password local password
     * @return the matching session, or empty if the credentials are wrong
     */
    Uni<Optional<Session>> authenticateLocal(String username, String password);

    /**
     * Look up a session by id.
     *
     * @param sessionId session identifier
     * @return the session, or empty if unknown
     */
    Uni<Optional<Session>> findSession(String sessionId);

    /**
     * Remove a session whose Jellyfin token was rejected. The user has to log
     * in through QuickConnect again.
     *
     * @param sessionId session identifier
     * @return Uni completing when the session is removed
     */
    Uni<Void> invalidateSession(String sessionId);
}
