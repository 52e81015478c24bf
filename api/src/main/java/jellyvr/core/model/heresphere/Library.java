package jellyvr.core.model.heresphere;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named list of video links shown as one library tab in HereSphere.
 */
public record Library(@JsonProperty("name") String name, @JsonProperty("list") List<String> list) {

    public Library {
        list = list == null ? List.of() : List.copyOf(list);
    }
}
