package jellyvr.core.model.heresphere;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Group of sources sharing an encoding, named after it.
 */
public record Media(@JsonProperty("name") String name, @JsonProperty("sources") List<MediaSource> sources) {

    public Media {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
