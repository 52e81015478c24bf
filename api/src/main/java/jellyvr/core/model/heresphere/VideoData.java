package jellyvr.core.model.heresphere;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Full detail of one video, returned from {@code POST /heresphere/{id}}.
 *
 * <p>{@code eventServer} is only set once a Jellyfin play session was opened for
 * the video, which happens when the player asks for media sources.
 */
public record VideoData(
        @JsonProperty("access") int access,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("thumbnailImage") String thumbnailImage,
        @JsonProperty("dateReleased") String dateReleased,
        @JsonProperty("dateAdded") String dateAdded,
        @JsonProperty("duration") double duration,
        @JsonProperty("rating") double rating,
        @JsonProperty("isFavorite") boolean isFavorite,
        @JsonProperty("projection") String projection,
        @JsonProperty("stereo") String stereo,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("eventServer") String eventServer,
        @JsonProperty("subtitles") List<Subtitle> subtitles,
        @JsonProperty("tags") List<Tag> tags,
        @JsonProperty("media") List<Media> media,
        @JsonProperty("writeHSP") boolean writeHsp) {

    public VideoData withEventServer(String eventServer) {
        return new VideoData(
                access,
                title,
                description,
                thumbnailImage,
                dateReleased,
                dateAdded,
                duration,
                rating,
                isFavorite,
                projection,
                stereo,
                eventServer,
                subtitles,
                tags,
                media,
                writeHsp);
    }

    public VideoData withMedia(List<Media> media) {
        return new VideoData(
                access,
                title,
                description,
                thumbnailImage,
                dateReleased,
                dateAdded,
                duration,
                rating,
                isFavorite,
                projection,
                stereo,
                eventServer,
                subtitles,
                tags,
                media,
                writeHsp);
    }
}
