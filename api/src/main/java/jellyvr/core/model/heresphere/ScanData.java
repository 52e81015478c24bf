package jellyvr.core.model.heresphere;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-video entry of the scan response, used by HereSphere to fill its
 * library grid without fetching every video.
 */
public record ScanData(
        @JsonProperty("link") String link,
        @JsonProperty("title") String title,
        @JsonProperty("dateReleased") String dateReleased,
        @JsonProperty("dateAdded") String dateAdded,
        @JsonProperty("duration") double duration,
        @JsonProperty("rating") double rating,
        @JsonProperty("favorites") int favorites,
        @JsonProperty("comments") int comments,
        @JsonProperty("isFavorite") boolean isFavorite,
        @JsonProperty("tags") List<Tag> tags,
        @JsonProperty("thumbnailImage") String thumbnailImage,
        @JsonProperty("media") List<Media> media,
        @JsonProperty("projection") String projection,
        @JsonProperty("stereo") String stereo,
        @JsonProperty("subtitles") List<Subtitle> subtitles) {}
