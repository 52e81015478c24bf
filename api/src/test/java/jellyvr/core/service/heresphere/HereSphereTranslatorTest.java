package jellyvr.core.service.heresphere;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import jellyvr.core.model.heresphere.Subtitle;
import jellyvr.core.model.heresphere.Tag;
import jellyvr.core.model.jellyfin.JellyfinItem;
import jellyvr.core.model.jellyfin.JellyfinMediaSource;
import jellyvr.core.model.jellyfin.JellyfinMediaStream;
import jellyvr.core.model.jellyfin.JellyfinUserData;
import jellyvr.core.model.jellyfin.PlaybackInfo;
import jellyvr.mock.JellyfinItemBuilder;

@DisplayName("HereSphereTranslator")
class HereSphereTranslatorTest {

    private static final TranslationContext CONTEXT = new TranslationContext("https://vr.example.com", "tok1");
    private static final JellyfinMediaStream VIDEO =
            new JellyfinMediaStream(0, "Video", "h264", null, null, false, 1920, 1080);

    private final HereSphereTranslator translator = new HereSphereTranslator(
            new MediaUrlRewriter("http://jellyfin:8096", "https://media.example.com"),
            TagPolicy.standard(),
            "Jellyfin",
            Optional.of("eng"));

    private static JellyfinMediaSource source(String id, JellyfinMediaStream... streams) {
        return new JellyfinMediaSource(id, "source", "mkv", 1234L, null, null, List.of(streams), null);
    }

    @Nested
    @DisplayName("library")
    class LibraryTests {

        @Test
        @DisplayName("should list every real item under one library in listing order")
        void shouldListItems() {
            final var items = List.of(
                    JellyfinItemBuilder.movie("m1", "Heat").build(),
                    JellyfinItemBuilder.episode("e1", "Pilot", "X").build());

            final var library = translator.library(items, CONTEXT);

            assertEquals(1, library.libraries().size());
            assertEquals("Jellyfin", library.libraries().get(0).name());
            assertEquals(
                    List.of("https://vr.example.com/heresphere/m1", "https://vr.example.com/heresphere/e1"),
                    library.libraries().get(0).list());
            assertEquals(2, library.size());
        }

        @Test
        @DisplayName("should skip virtual items")
        void shouldSkipVirtualItems() {
            final var items = List.of(
                    JellyfinItemBuilder.movie("m1", "Heat").build(),
                    JellyfinItemBuilder.episode("e2", "Missing", "X").virtual().build());

            assertEquals(1, translator.library(items, CONTEXT).size());
        }

        @Test
        @DisplayName("should keep an item that lacks optional metadata")
        void shouldKeepSparseItem() {
            final var sparse = JellyfinItemBuilder.movie("m1", null).build();

            final var library = translator.library(List.of(sparse), CONTEXT);

            final var entry = library.scan().scanData().get(0);
            assertEquals("", entry.title());
            assertEquals("", entry.dateReleased());
            assertEquals(0.0, entry.duration());
            assertTrue(entry.media().isEmpty());
            assertTrue(entry.subtitles().isEmpty());
        }

        @Test
        @DisplayName("should drop only the item that fails to translate")
        void shouldDropFailingItem() {
            final var failing = new TagPolicy(
                    List.of(new TagPolicy.Rule("Genre", item -> {
                        if (item.id().equals("bad")) {
                            throw new IllegalStateException("broken metadata");
                        }
                        return item.genres();
                    })),
                    Map.of());
            final var strict = new HereSphereTranslator(
                    new MediaUrlRewriter("http://jellyfin:8096", "https://media.example.com"),
                    failing,
                    "Jellyfin",
                    Optional.empty());
            final var items = List.of(
                    JellyfinItemBuilder.movie("good", "Good").build(),
                    JellyfinItemBuilder.movie("bad", "Bad").build());

            final var library = strict.library(items, CONTEXT);

            assertEquals(List.of("https://vr.example.com/heresphere/good"), library.libraries().get(0).list());
        }
    }

    @Nested
    @DisplayName("Entry fields")
    class EntryTests {

        @Test
        @DisplayName("should translate metadata fields and tags")
        void shouldTranslateFields() {
            final var item = JellyfinItemBuilder.episode("e1", "Pilot", "X")
                    .seriesStudio("Y")
                    .season("Season 1", 1, 2)
                    .premiereDate(LocalDate.of(2020, 5, 17))
                    .dateCreated(Instant.parse("2024-01-02T23:30:00Z"))
                    .runTimeTicks(36_000_000_000L)
                    .communityRating(8.0)
                    .userData(new JellyfinUserData(false, 0L, true))
                    .build();

            final var entry = translator.scanData(item, CONTEXT);

            assertEquals("https://vr.example.com/heresphere/e1", entry.link());
            assertEquals("S01E02 - Pilot", entry.title());
            assertEquals("2020-05-17", entry.dateReleased());
            assertEquals("2024-01-02", entry.dateAdded());
            assertEquals(3_600_000.0, entry.duration());
            assertEquals(4.0, entry.rating());
            assertTrue(entry.isFavorite());
            assertEquals(HereSphereTranslator.PROJECTION, entry.projection());
            final var tags = entry.tags().stream().map(Tag::name).toList();
            assertTrue(tags.containsAll(List.of("Series:X", "Studio:Y", "Series:Y", "Season:Season 1")));
        }

        @Test
        @DisplayName("should point media, thumbnails and subtitles at the external host")
        void shouldRewriteMediaUrls() {
            final var english = new JellyfinMediaStream(3, "Subtitle", "srt", "eng", "English", true, null, null);
            final var german = new JellyfinMediaStream(2, "Subtitle", "srt", "ger", null, true, null, null);
            final var image = new JellyfinMediaStream(4, "Subtitle", "pgssub", "fre", null, false, null, null);
            final var item = JellyfinItemBuilder.movie("m1", "Heat")
                    .mediaSource(source("src1", VIDEO, german, english, image))
                    .build();

            final var entry = translator.scanData(item, CONTEXT);

            assertEquals(
                    "https://media.example.com/Items/m1/Images/Backdrop?maxHeight=300&maxWidth=300&quality=90"
                            + "&api_key=tok1",
                    entry.thumbnailImage());
            final var media = entry.media().get(0);
            assertEquals("mkv", media.name());
            assertEquals("https://media.example.com/Items/src1/Download?api_key=tok1", media.sources().get(0).url());
            assertEquals(1080, media.sources().get(0).resolution());
            assertEquals(1920, media.sources().get(0).width());
            assertEquals(1234L, media.sources().get(0).size());
            assertEquals(
                    List.of(
                            new Subtitle(
                                    "English",
                                    "eng",
                                    "https://media.example.com/Videos/m1/src1/Subtitles/3/Stream.srt?api_key=tok1"),
                            new Subtitle(
                                    "ger",
                                    "ger",
                                    "https://media.example.com/Videos/m1/src1/Subtitles/2/Stream.srt?api_key=tok1")),
                    entry.subtitles());
        }

        @Test
        @DisplayName("should leave the event server off a plain video lookup")
        void shouldOmitEventServer() {
            final var video = translator.video(JellyfinItemBuilder.movie("m1", "Heat").build(), CONTEXT);

            assertEquals(1, video.access());
            assertNull(video.eventServer());
            assertEquals("", video.description());
        }
    }

    @Nested
    @DisplayName("playbackMedia")
    class PlaybackMediaTests {

        @Test
        @DisplayName("should use Jellyfin's transcoding URL when offered")
        void shouldUseTranscodingUrl() {
            final var transcoding = new JellyfinMediaSource(
                    "src1", "source", "mkv", null, null, null, List.of(VIDEO), "/videos/m1/master.m3u8?x=1");

            final var media = translator.playbackMedia("m1", new PlaybackInfo("ps1", List.of(transcoding)), CONTEXT);

            assertEquals("hls", media.name());
            assertEquals("https://media.example.com/videos/m1/master.m3u8?x=1", media.sources().get(0).url());
            assertEquals(1080, media.sources().get(0).height());
        }

        @Test
        @DisplayName("should fall back to the HLS master playlist")
        void shouldFallBackToMasterPlaylist() {
            final var media = translator.playbackMedia("m1", new PlaybackInfo("ps1", List.of()), CONTEXT);

            assertEquals(
                    "https://media.example.com/Videos/m1/master.m3u8?playSessionId=ps1&api_key=tok1"
                            + "&mediaSourceId=m1",
                    media.sources().get(0).url());
        }
    }

    @Test
    @DisplayName("should not prefix titles of episodes without numbers")
    void shouldKeepPlainEpisodeTitle() {
        final JellyfinItem item = JellyfinItemBuilder.episode("e1", "Pilot", "X").build();

        assertEquals("Pilot", translator.title(item));
    }
}
