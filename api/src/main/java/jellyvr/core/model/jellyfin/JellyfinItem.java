package jellyvr.core.model.jellyfin;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A library item as returned by Jellyfin, reduced to the fields the gateway
 * translates. Every field except {@code id} may be absent.
 */
public record JellyfinItem(
        String id,
        String name,
        String type,
        String overview,
        LocalDate premiereDate,
        Instant dateCreated,
        Integer productionYear,
        Long runTimeTicks,
        Double communityRating,
        String seriesName,
        String seriesStudio,
        String seasonName,
        Integer indexNumber,
        Integer parentIndexNumber,
        String locationType,
        List<String> genres,
        List<String> tags,
        List<String> studios,
        List<JellyfinPerson> people,
        List<JellyfinChapter> chapters,
        List<JellyfinMediaSource> mediaSources,
        JellyfinUserData userData) {

    public static final String TYPE_MOVIE = "Movie";
    public static final String TYPE_EPISODE = "Episode";
    public static final String LOCATION_VIRTUAL = "Virtual";

    public JellyfinItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Jellyfin item id cannot be blank");
        }
        genres = copy(genres);
        tags = copy(tags);
        studios = copy(studios);
        people = copy(people);
        chapters = copy(chapters);
        mediaSources = copy(mediaSources);
        userData = userData == null ? JellyfinUserData.NONE : userData;
    }

    public boolean isMovie() {
        return TYPE_MOVIE.equals(type);
    }

    public boolean isEpisode() {
        return TYPE_EPISODE.equals(type);
    }

    /**
     * Items Jellyfin knows about but has no file for (missing episodes).
     */
    public boolean isVirtual() {
        return LOCATION_VIRTUAL.equals(locationType);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : values.stream().filter(v -> v != null).toList();
    }
}
