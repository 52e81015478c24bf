package jellyvr.core.model.session;

/**
 * What the browser learns once a login is approved: the session and the
 * credential pair to type into the VR client.
 *
 * @param sessionId session identifier
 * @param username local username
 * @param password plaintext local password (only ever shown once)
 */
public record SessionIdentity(String sessionId, String username, String password) {

    @Override
    public String toString() {
        return "SessionIdentity[sessionId=" + sessionId + ", username=" + username + "]";
    }
}
