package jellyvr.adapter.out.jellyfin;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.jboss.logging.Logger;

import jellyvr.core.model.jellyfin.JellyfinChapter;
import jellyvr.core.model.jellyfin.JellyfinItem;
import jellyvr.core.model.jellyfin.JellyfinMediaSource;
import jellyvr.core.model.jellyfin.JellyfinMediaStream;
import jellyvr.core.model.jellyfin.JellyfinPerson;
import jellyvr.core.model.jellyfin.JellyfinUserData;

/**
 * Reads Jellyfin's PascalCase DTOs into the gateway's model.
 *
 * <p>A field that is missing, null or of an unexpected type is treated as
 * absent; it never fails the item.
 */
final class JellyfinJsonMapper {

    private static final Logger LOG = Logger.getLogger(JellyfinJsonMapper.class);

    private JellyfinJsonMapper() {}

    /**
     * Items of a {@code BaseItemDtoQueryResult}. Entries without an id are skipped.
     */
    static List<JellyfinItem> items(JsonObject queryResult) {
        final var array = queryResult.getValue("Items") instanceof JsonArray items ? items : new JsonArray();
        final var result = new ArrayList<JellyfinItem>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (!(array.getValue(i) instanceof JsonObject json)) {
                continue;
            }
            final var item = item(json);
            if (item.isPresent()) {
                result.add(item.get());
            } else {
                LOG.warnf("Skipping Jellyfin item without an id: %s", string(json, "Name"));
            }
        }
        return result;
    }

    static Optional<JellyfinItem> item(JsonObject json) {
        final var id = string(json, "Id");
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new JellyfinItem(
                id,
                string(json, "Name"),
                string(json, "Type"),
                string(json, "Overview"),
                Optional.ofNullable(instant(json, "PremiereDate"))
                        .map(date -> LocalDate.ofInstant(date, ZoneOffset.UTC))
                        .orElse(null),
                instant(json, "DateCreated"),
                integer(json, "ProductionYear"),
                longValue(json, "RunTimeTicks"),
                doubleValue(json, "CommunityRating"),
                string(json, "SeriesName"),
                string(json, "SeriesStudio"),
                string(json, "SeasonName"),
                integer(json, "IndexNumber"),
                integer(json, "ParentIndexNumber"),
                string(json, "LocationType"),
                strings(json, "Genres"),
                strings(json, "Tags"),
                objects(json, "Studios", studio -> string(studio, "Name")),
                objects(json, "People", JellyfinJsonMapper::person),
                objects(json, "Chapters", JellyfinJsonMapper::chapter),
                mediaSources(json),
                userData(json)));
    }

    static List<JellyfinMediaSource> mediaSources(JsonObject json) {
        return objects(json, "MediaSources", JellyfinJsonMapper::mediaSource);
    }

    /**
     * Raw number of entries on a page, including ones {@link #items} skipped.
     */
    static int pageLength(JsonObject queryResult) {
        return queryResult.getValue("Items") instanceof JsonArray items ? items.size() : 0;
    }

    static long total(JsonObject queryResult) {
        final var total = longValue(queryResult, "TotalRecordCount");
        return total == null ? 0L : total;
    }

    private static JellyfinPerson person(JsonObject json) {
        final var name = string(json, "Name");
        return name == null ? null : new JellyfinPerson(name, string(json, "Role"), string(json, "Type"));
    }

    private static JellyfinChapter chapter(JsonObject json) {
        final var start = longValue(json, "StartPositionTicks");
        return new JellyfinChapter(string(json, "Name"), start == null ? 0L : start);
    }

    private static JellyfinMediaSource mediaSource(JsonObject json) {
        return new JellyfinMediaSource(
                string(json, "Id"),
                string(json, "Name"),
                string(json, "Container"),
                longValue(json, "Size"),
                integer(json, "Bitrate"),
                longValue(json, "RunTimeTicks"),
                objects(json, "MediaStreams", JellyfinJsonMapper::mediaStream),
                string(json, "TranscodingUrl"));
    }

    private static JellyfinMediaStream mediaStream(JsonObject json) {
        final var index = integer(json, "Index");
        if (index == null) {
            return null;
        }
        return new JellyfinMediaStream(
                index,
                string(json, "Type"),
                string(json, "Codec"),
                string(json, "Language"),
                string(json, "DisplayTitle"),
                Boolean.TRUE.equals(bool(json, "IsTextSubtitleStream")),
                integer(json, "Width"),
                integer(json, "Height"));
    }

    private static JellyfinUserData userData(JsonObject json) {
        if (!(json.getValue("UserData") instanceof JsonObject data)) {
            return JellyfinUserData.NONE;
        }
        final var position = longValue(data, "PlaybackPositionTicks");
        return new JellyfinUserData(
                Boolean.TRUE.equals(bool(data, "Played")),
                position == null ? 0L : position,
                Boolean.TRUE.equals(bool(data, "IsFavorite")));
    }

    static String string(JsonObject json, String field) {
        return json.getValue(field) instanceof String value ? value : null;
    }

    private static Integer integer(JsonObject json, String field) {
        return json.getValue(field) instanceof Number value ? value.intValue() : null;
    }

    private static Long longValue(JsonObject json, String field) {
        return json.getValue(field) instanceof Number value ? value.longValue() : null;
    }

    private static Double doubleValue(JsonObject json, String field) {
        return json.getValue(field) instanceof Number value ? value.doubleValue() : null;
    }

    static Boolean bool(JsonObject json, String field) {
        return json.getValue(field) instanceof Boolean value ? value : null;
    }

    private static List<String> strings(JsonObject json, String field) {
        if (!(json.getValue(field) instanceof JsonArray array)) {
            return List.of();
        }
        final var result = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (array.getValue(i) instanceof String value) {
                result.add(value);
            }
        }
        return result;
    }

    private static <T> List<T> objects(JsonObject json, String field, Function<JsonObject, T> mapper) {
        if (!(json.getValue(field) instanceof JsonArray array)) {
            return List.of();
        }
        final var result = new ArrayList<T>(array.size());
        for (int i = 0; i < array.size(); i++) {
            if (array.getValue(i) instanceof JsonObject element) {
                final var mapped = mapper.apply(element);
                if (mapped != null) {
                    result.add(mapped);
                }
            }
        }
        return result;
    }

    /**
     * Jellyfin writes seven fractional digits and usually, but not always, a zone.
     */
    private static Instant instant(JsonObject json, String field) {
        final var text = string(json, field);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the zone-less forms
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through to a plain date
        }
        try {
            return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable %s: %s", field, text);
            return null;
        }
    }
}
