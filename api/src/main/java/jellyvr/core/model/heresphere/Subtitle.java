package jellyvr.core.model.heresphere;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Subtitle(
        @JsonProperty("name") String name,
        @JsonProperty("language") String language,
        @JsonProperty("url") String url) {}
