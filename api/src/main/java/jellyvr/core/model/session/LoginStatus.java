package jellyvr.core.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Result of polling a browser login.
 *
 * @param state where the login stands
 * @param displayCode QuickConnect code (pending and expired logins)
 * @param identity approved identity (approved logins only)
 */
public record LoginStatus(State state, String displayCode, SessionIdentity identity) {

    public enum State {
        /** Waiting for the user to enter the code in Jellyfin. */
        PENDING,
        /** Approved; a session exists. */
        APPROVED,
        /** The window elapsed or Jellyfin rejected the request; restart login. */
        EXPIRED,
        /** No such request is known. */
        UNKNOWN
    }

    public static LoginStatus pending(String displayCode) {
        return new LoginStatus(State.PENDING, displayCode, null);
    }

    public static LoginStatus approved(SessionIdentity identity) {
        return new LoginStatus(State.APPROVED, null, identity);
    }

    public static LoginStatus expired(String displayCode) {
        return new LoginStatus(State.EXPIRED, displayCode, null);
    }

    public static LoginStatus unknown() {
        return new LoginStatus(State.UNKNOWN, null, null);
    }

    /**
     * Status implied by a persisted request.
     */
    public static LoginStatus of(QuickConnectRequest request) {
        return switch (request.status()) {
            case PENDING -> pending(request.displayCode());
            case AUTHORIZED -> approved(request.identity());
            case EXPIRED -> expired(request.displayCode());
        };
    }

    @JsonIgnore
    public boolean isApproved() {
        return state == State.APPROVED;
    }
}
