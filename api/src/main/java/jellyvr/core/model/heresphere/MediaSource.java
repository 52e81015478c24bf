package jellyvr.core.model.heresphere;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One playable URL.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MediaSource(
        @JsonProperty("resolution") Integer resolution,
        @JsonProperty("height") Integer height,
        @JsonProperty("width") Integer width,
        @JsonProperty("size") Long size,
        @JsonProperty("url") String url) {

    public static MediaSource of(String url) {
        return new MediaSource(null, null, null, null, url);
    }
}
