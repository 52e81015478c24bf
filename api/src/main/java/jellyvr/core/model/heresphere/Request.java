package jellyvr.core.model.heresphere;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body HereSphere posts to the index, scan and video endpoints. Only the
 * credentials and {@code needsMediaSource} are acted on.
 */
public record Request(
        @JsonProperty("username") String username,
        @JsonProperty("password") String password,
        @JsonProperty("isFavorite") Boolean isFavorite,
        @JsonProperty("rating") Double rating,
        @JsonProperty("needsMediaSource") Boolean needsMediaSource) {

    public boolean wantsMediaSource() {
        return Boolean.TRUE.equals(needsMediaSource);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty() && password != null && !password.isEmpty();
    }
}
