package jellyvr.core.model.session;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One in-flight device-authorization attempt started from a browser.
 *
 * <p>While {@link QuickConnectRequestStatus#PENDING} it is polled against
 * Jellyfin. Authorizing it records the session it produced together with the
 * one-time password reveal, so every concurrent poller can report the same
 * identity. A pending request replaced by a newer one from the same browser is
 * kept as expired with {@code supersededBy} set.
 *
 * @param secret Jellyfin QuickConnect secret, also the record identifier
 * @param displayCode code the user enters in an authenticated Jellyfin client
 * @param status lifecycle state
 * @param createdAt creation time
 * @param expiresAt end of the authorization window
 * @param sessionId session created on approval (null until authorized)
 * @param revealUsername local username shown once to the browser (null until authorized)
 * @param revealPassword plaintext local password shown once to the browser (null until authorized)
 * @param supersededBy secret of the request that replaced this one, if any
 * @param expiredReason why the request expired, if it did
 */
public record QuickConnectRequest(
        String secret,
        String displayCode,
        QuickConnectRequestStatus status,
        Instant createdAt,
        Instant expiresAt,
        String sessionId,
        String revealUsername,
        String revealPassword,
        String supersededBy,
        String expiredReason) {

    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_REJECTED = "rejected";
    public static final String REASON_SUPERSEDED = "superseded";

    public static QuickConnectRequest pending(String secret, String displayCode, Instant createdAt, Instant expiresAt) {
        return new QuickConnectRequest(
                secret, displayCode, QuickConnectRequestStatus.PENDING, createdAt, expiresAt, null, null, null, null,
                null);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == QuickConnectRequestStatus.PENDING;
    }

    /**
     * Whether the authorization window has elapsed at {@code now}.
     */
    public boolean isPastWindow(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public QuickConnectRequest authorize(SessionIdentity identity) {
        requirePending("authorize");
        return new QuickConnectRequest(
                secret,
                displayCode,
                QuickConnectRequestStatus.AUTHORIZED,
                createdAt,
                expiresAt,
                identity.sessionId(),
                identity.username(),
                identity.password(),
                null,
                null);
    }

    public QuickConnectRequest expire(String reason) {
        requirePending("expire");
        return new QuickConnectRequest(
                secret,
                displayCode,
                QuickConnectRequestStatus.EXPIRED,
                createdAt,
                expiresAt,
                null,
                null,
                null,
                supersededBy,
                reason);
    }

    public QuickConnectRequest supersede(String newerSecret) {
        requirePending("supersede");
        return new QuickConnectRequest(
                secret,
                displayCode,
                QuickConnectRequestStatus.EXPIRED,
                createdAt,
                expiresAt,
                null,
                null,
                null,
                newerSecret,
                REASON_SUPERSEDED);
    }

    /**
     * The identity recorded when this request was authorized.
     *
     * @throws IllegalStateException if the request is not authorized
     */
    public SessionIdentity identity() {
        if (status != QuickConnectRequestStatus.AUTHORIZED) {
            throw new IllegalStateException("QuickConnect request " + displayCode + " is " + status);
        }
        return new SessionIdentity(sessionId, revealUsername, revealPassword);
    }

    private void requirePending(String transition) {
        if (status != QuickConnectRequestStatus.PENDING) {
            throw new IllegalStateException(
                    "Cannot " + transition + " QuickConnect request " + displayCode + " in state " + status);
        }
    }

    @Override
    public String toString() {
        return "QuickConnectRequest[displayCode=" + displayCode + ", status=" + status + ", createdAt=" + createdAt
                + ", expiresAt=" + expiresAt + ", sessionId=" + sessionId + "]";
    }
}
