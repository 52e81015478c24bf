package jellyvr.core.service.heresphere;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import jellyvr.core.config.HereSphereConfig;
import jellyvr.core.model.heresphere.Library;
import jellyvr.core.model.heresphere.Media;
import jellyvr.core.model.heresphere.MediaSource;
import jellyvr.core.model.heresphere.Scan;
import jellyvr.core.model.heresphere.ScanData;
import jellyvr.core.model.heresphere.Subtitle;
import jellyvr.core.model.heresphere.TranslatedLibrary;
import jellyvr.core.model.heresphere.VideoData;
import jellyvr.core.model.jellyfin.JellyfinItem;
import jellyvr.core.model.jellyfin.JellyfinMediaSource;
import jellyvr.core.model.jellyfin.JellyfinMediaStream;
import jellyvr.core.model.jellyfin.PlaybackInfo;
import jellyvr.core.model.jellyfin.Ticks;

/**
 * Reshapes Jellyfin items into HereSphere's schema.
 *
 * <p>Stateless. Translating a whole library never fails because of one item:
 * virtual items are skipped and an item that cannot be translated is logged and
 * left out.
 */
@ApplicationScoped
public class HereSphereTranslator {

    private static final Logger LOG = Logger.getLogger(HereSphereTranslator.class);

    static final String PROJECTION = "perspective";
    static final String STEREO = "mono";
    static final String UNKNOWN_LANGUAGE = "und";
    private static final String THUMBNAIL_QUERY = "?maxHeight=300&maxWidth=300&quality=90&api_key=";

    private final MediaUrlRewriter urlRewriter;
    private final TagPolicy tagPolicy;
    private final String libraryName;
    private final Optional<String> subtitleLanguage;

    @Inject
    public HereSphereTranslator(MediaUrlRewriter urlRewriter, HereSphereConfig config) {
        this(urlRewriter, TagPolicy.standard(), config.libraryName(), config.subtitleLanguage());
    }

    public HereSphereTranslator(
            MediaUrlRewriter urlRewriter, TagPolicy tagPolicy, String libraryName, Optional<String> subtitleLanguage) {
        this.urlRewriter = urlRewriter;
        this.tagPolicy = tagPolicy;
        this.libraryName = libraryName;
        this.subtitleLanguage = subtitleLanguage;
    }

    /**
     * Translate a full listing into the index and scan responses.
     *
     * @param items items in listing order
     * @param context request context
     * @return translated library
     */
    public TranslatedLibrary library(List<JellyfinItem> items, TranslationContext context) {
        List<String> links = new ArrayList<>(items.size());
        List<ScanData> scanData = new ArrayList<>(items.size());
        for (JellyfinItem item : items) {
            if (item.isVirtual()) {
                continue;
            }
            try {
                ScanData data = scanData(item, context);
                scanData.add(data);
                links.add(data.link());
            } catch (RuntimeException e) {
                LOG.warnv(e, "Dropping item {0} ({1}) that could not be translated", item.id(), item.name());
            }
        }
        return new TranslatedLibrary(List.of(new Library(libraryName, links)), new Scan(scanData));
    }

    public ScanData scanData(JellyfinItem item, TranslationContext context) {
        return new ScanData(
                context.videoLink(item.id()),
                title(item),
                releaseDate(item),
                addedDate(item),
                durationMillis(item),
                rating(item),
                0,
                0,
                item.userData().favorite(),
                tagPolicy.tagsFor(item),
                thumbnail(item, context),
                media(item, context),
                PROJECTION,
                STEREO,
                subtitles(item, context));
    }

    public VideoData video(JellyfinItem item, TranslationContext context) {
        return new VideoData(
                1,
                title(item),
                item.overview() == null ? "" : item.overview(),
                thumbnail(item, context),
                releaseDate(item),
                addedDate(item),
                durationMillis(item),
                rating(item),
                item.userData().favorite(),
                PROJECTION,
                STEREO,
                null,
                subtitles(item, context),
                tagPolicy.tagsFor(item),
                media(item, context),
                false);
    }

    /**
     * Media for an open play session: Jellyfin's transcoding URL when it offers
     * one, otherwise its HLS master playlist.
     *
     * @param itemId item being played
     * @param info play session opened for the item
     * @param context request context
     * @return single HLS media entry
     */
    public Media playbackMedia(String itemId, PlaybackInfo info, TranslationContext context) {
        Optional<JellyfinMediaSource> source = info.mediaSources().stream().findFirst();
        String path = source.map(JellyfinMediaSource::transcodingUrl)
                .filter(url -> !url.isBlank())
                .orElseGet(() -> "/Videos/" + itemId + "/master.m3u8?playSessionId=" + info.playSessionId()
                        + "&api_key=" + context.accessToken()
                        + "&mediaSourceId=" + source.map(JellyfinMediaSource::id).orElse(itemId));
        Optional<JellyfinMediaStream> video = source.flatMap(JellyfinMediaSource::videoStream);
        return new Media(
                "hls",
                List.of(new MediaSource(
                        video.map(JellyfinMediaStream::height).orElse(null),
                        video.map(JellyfinMediaStream::height).orElse(null),
                        video.map(JellyfinMediaStream::width).orElse(null),
                        null,
                        urlRewriter.rewrite(path))));
    }

    String title(JellyfinItem item) {
        String name = item.name() == null ? "" : item.name();
        if (item.isEpisode() && item.parentIndexNumber() != null && item.indexNumber() != null) {
            return String.format("S%02dE%02d - %s", item.parentIndexNumber(), item.indexNumber(), name);
        }
        return name;
    }

    private List<Media> media(JellyfinItem item, TranslationContext context) {
        List<Media> media = new ArrayList<>();
        for (JellyfinMediaSource source : item.mediaSources()) {
            if (source.id() == null) {
                continue;
            }
            Optional<JellyfinMediaStream> video = source.videoStream();
            String url = urlRewriter.rewrite("/Items/" + source.id() + "/Download?api_key=" + context.accessToken());
            media.add(new Media(
                    source.container() == null ? "original" : source.container(),
                    List.of(new MediaSource(
                            video.map(JellyfinMediaStream::height).orElse(null),
                            video.map(JellyfinMediaStream::height).orElse(null),
                            video.map(JellyfinMediaStream::width).orElse(null),
                            source.size(),
                            url))));
        }
        return media;
    }

    private List<Subtitle> subtitles(JellyfinItem item, TranslationContext context) {
        Optional<JellyfinMediaSource> source = item.mediaSources().stream().findFirst();
        if (source.isEmpty()) {
            return List.of();
        }
        List<Subtitle> subtitles = new ArrayList<>();
        for (JellyfinMediaStream stream : source.get().textSubtitles()) {
            String language = stream.language() == null ? UNKNOWN_LANGUAGE : stream.language();
            String name = stream.displayTitle() != null ? stream.displayTitle() : language;
            String url = urlRewriter.rewrite("/Videos/" + item.id() + "/" + source.get().id() + "/Subtitles/"
                    + stream.index() + "/Stream." + stream.codec() + "?api_key=" + context.accessToken());
            subtitles.add(new Subtitle(name, language, url));
        }
        subtitleLanguage.ifPresent(preferred -> subtitles.sort(
                Comparator.comparing((Subtitle subtitle) -> !preferred.equalsIgnoreCase(subtitle.language()))));
        return subtitles;
    }

    private String thumbnail(JellyfinItem item, TranslationContext context) {
        String imageType = item.isMovie() ? "Backdrop" : "Primary";
        return urlRewriter.rewrite(
                "/Items/" + item.id() + "/Images/" + imageType + THUMBNAIL_QUERY + context.accessToken());
    }

    private static String releaseDate(JellyfinItem item) {
        LocalDate date = item.premiereDate();
        return date == null ? "" : date.toString();
    }

    private static String addedDate(JellyfinItem item) {
        return item.dateCreated() == null
                ? ""
                : LocalDate.ofInstant(item.dateCreated(), ZoneOffset.UTC).toString();
    }

    private static double durationMillis(JellyfinItem item) {
        return item.runTimeTicks() == null ? 0.0 : Ticks.toMillis(item.runTimeTicks());
    }

    private static double rating(JellyfinItem item) {
        return item.communityRating() == null ? 0.0 : item.communityRating() / 2.0;
    }
}
