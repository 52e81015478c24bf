package jellyvr.core.model.jellyfin;

/**
 * Credentials for calls made on behalf of one Jellyfin user.
 *
 * @param userId Jellyfin user id
 * @param accessToken access token issued by Jellyfin
 * @param deviceId device id the token is bound to
 */
public record JellyfinUser(String userId, String accessToken, String deviceId) {

    @Override
    public String toString() {
        return "JellyfinUser[userId=" + userId + ", deviceId=" + deviceId + "]";
    }
}
