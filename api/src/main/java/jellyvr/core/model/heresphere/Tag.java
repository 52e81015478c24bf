package jellyvr.core.model.heresphere;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HereSphere tag. Tags with a time range ({@code start}/{@code end}, in
 * milliseconds) show up on the timeline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Tag(
        @JsonProperty("name") String name,
        @JsonProperty("start") Double start,
        @JsonProperty("end") Double end,
        @JsonProperty("track") Integer track,
        @JsonProperty("rating") Double rating) {

    public static Tag of(String name) {
        return new Tag(name, null, null, null, null);
    }

    public static Tag spanning(String name, double start, double end) {
        return new Tag(name, start, end, null, null);
    }
}
