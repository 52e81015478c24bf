package jellyvr.core.model.session;

import java.time.Instant;

import jellyvr.core.model.jellyfin.JellyfinUser;

/**
 * One authenticated local identity bound to a Jellyfin account.
 *
 * <p>Created when a QuickConnect request is approved. Immutable once issued,
 * except for {@code lastUsedAt} and the Jellyfin access token. Sessions do not
 * expire on their own; Jellyfin rejecting the token is the only expiry signal.
 *
 * @param sessionId opaque, cryptographically random identifier
 * @param jellyfinUserId Jellyfin user id
 * @param jellyfinAccessToken Jellyfin-issued access token
 * @param localUsername username the VR client logs in with (the Jellyfin username)
 * @param passwordHash salted hash of the local password
 * @param passwordSalt salt used for {@code passwordHash}
 * @param deviceId Jellyfin device id the token was issued for
 * @param createdAt issuance time
 * @param lastUsedAt last successful local authentication
 */
public record Session(
        String sessionId,
        String jellyfinUserId,
        String jellyfinAccessToken,
        String localUsername,
        String passwordHash,
        String passwordSalt,
        String deviceId,
        Instant createdAt,
        Instant lastUsedAt) {

    public Session withLastUsedAt(Instant lastUsedAt) {
        return new Session(
                sessionId,
                jellyfinUserId,
                jellyfinAccessToken,
                localUsername,
                passwordHash,
                passwordSalt,
                deviceId,
                createdAt,
                lastUsedAt);
    }

    public Session withAccessToken(String jellyfinAccessToken) {
        return new Session(
                sessionId,
                jellyfinUserId,
                jellyfinAccessToken,
                localUsername,
                passwordHash,
                passwordSalt,
                deviceId,
                createdAt,
                lastUsedAt);
    }

    /**
     * The Jellyfin identity to pass on upstream calls made for this session.
     */
    public JellyfinUser jellyfinUser() {
        return new JellyfinUser(jellyfinUserId, jellyfinAccessToken, deviceId);
    }

    @Override
    public String toString() {
        return "Session[sessionId=" + sessionId + ", jellyfinUserId=" + jellyfinUserId + ", localUsername="
                + localUsername + ", createdAt=" + createdAt + ", lastUsedAt=" + lastUsedAt + "]";
    }
}
