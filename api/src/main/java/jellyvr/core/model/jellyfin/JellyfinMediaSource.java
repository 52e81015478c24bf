package jellyvr.core.model.jellyfin;

import java.util.List;
import java.util.Optional;

/**
 * A playable version of an item.
 *
 * @param id media source id
 * @param name display name
 * @param container container format (mkv, mp4, ...)
 * @param size file size in bytes
 * @param bitrate total bitrate
 * @param runTimeTicks duration
 * @param mediaStreams streams in this source
 * @param transcodingUrl server-relative transcoding URL when Jellyfin offers one
 */
public record JellyfinMediaSource(
        String id,
        String name,
        String container,
        Long size,
        Integer bitrate,
        Long runTimeTicks,
        List<JellyfinMediaStream> mediaStreams,
        String transcodingUrl) {

    public JellyfinMediaSource {
        mediaStreams = mediaStreams == null ? List.of() : List.copyOf(mediaStreams);
    }

    public Optional<JellyfinMediaStream> videoStream() {
        return mediaStreams.stream().filter(JellyfinMediaStream::isVideo).findFirst();
    }

    public List<JellyfinMediaStream> textSubtitles() {
        return mediaStreams.stream()
                .filter(s -> s.isSubtitle() && s.textSubtitle())
                .toList();
    }
}
