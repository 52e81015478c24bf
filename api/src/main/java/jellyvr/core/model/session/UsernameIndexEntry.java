package jellyvr.core.model.session;

/**
 * Points a local username at its current session.
 *
 * @param username local username
 * @param sessionId session the username logs into
 */
public record UsernameIndexEntry(String username, String sessionId) {}
