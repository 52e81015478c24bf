package jellyvr.core.model.jellyfin;

/**
 * One stream inside a media source.
 *
 * @param index stream index within the source
 * @param type Video, Audio or Subtitle
 * @param codec codec name
 * @param language ISO language code, may be null
 * @param displayTitle human readable title, may be null
 * @param textSubtitle whether this is a text subtitle stream Jellyfin can serve as a file
 * @param width frame width for video streams
 * @param height frame height for video streams
 */
public record JellyfinMediaStream(
        int index,
        String type,
        String codec,
        String language,
        String displayTitle,
        boolean textSubtitle,
        Integer width,
        Integer height) {

    public boolean isVideo() {
        return "Video".equals(type);
    }

    public boolean isSubtitle() {
        return "Subtitle".equals(type);
    }
}
