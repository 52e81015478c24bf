package jellyvr.core.service.heresphere;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import jellyvr.core.model.heresphere.Tag;
import jellyvr.core.model.jellyfin.JellyfinChapter;
import jellyvr.core.model.jellyfin.JellyfinItem;
import jellyvr.core.model.jellyfin.JellyfinPerson;
import jellyvr.core.model.jellyfin.Ticks;

/**
 * Maps Jellyfin item fields to HereSphere {@code Category:value} tags.
 *
 * <p>Each rule reads one field; a missing field yields no tags. Aliases copy a
 * category's values into further categories, e.g. studios also appear as series
 * so HereSphere groups a studio's movies with TV series.
 */
public final class TagPolicy {

    static final String PERSON_FALLBACK_CATEGORY = "Person";

    private final List<Rule> rules;
    private final Map<String, List<String>> aliases;

    public TagPolicy(List<Rule> rules, Map<String, List<String>> aliases) {
        this.rules = List.copyOf(rules);
        this.aliases = Map.copyOf(aliases);
    }

    /**
     * Rules and aliases used by the gateway.
     */
    public static TagPolicy standard() {
        return new TagPolicy(
                List.of(
                        new Rule("Type", item -> single(item.type())),
                        new Rule("Movie", item -> item.isMovie() ? single(item.name()) : List.of()),
                        new Rule("Series", item -> item.isEpisode() ? single(item.seriesName()) : List.of()),
                        new Rule("Season", item -> item.isEpisode() ? single(item.seasonName()) : List.of()),
                        new Rule("Studio", TagPolicy::studios),
                        new Rule("Genre", JellyfinItem::genres),
                        new Rule("Tag", JellyfinItem::tags),
                        new Rule(
                                "Year",
                                item -> Optional.ofNullable(item.productionYear())
                                        .map(year -> List.of(String.valueOf(year)))
                                        .orElse(List.of()))),
                Map.of("Studio", List.of("Series")));
    }

    /**
     * All tags for an item: field tags, people, then chapter markers.
     */
    public List<Tag> tagsFor(JellyfinItem item) {
        Set<Tag> tags = new LinkedHashSet<>();
        for (Rule rule : rules) {
            for (String value : rule.values().apply(item)) {
                if (value == null || value.isBlank()) {
                    continue;
                }
                String trimmed = value.trim();
                tags.add(Tag.of(rule.category() + ":" + trimmed));
                for (String alias : aliases.getOrDefault(rule.category(), List.of())) {
                    tags.add(Tag.of(alias + ":" + trimmed));
                }
            }
        }
        tags.addAll(people(item.people()));
        tags.addAll(chapters(item.chapters(), item.runTimeTicks()));
        return new ArrayList<>(tags);
    }

    private static List<Tag> people(List<JellyfinPerson> people) {
        List<Tag> tags = new ArrayList<>();
        for (JellyfinPerson person : people) {
            if (person.name() == null || person.name().isBlank()) {
                continue;
            }
            String category = person.type() == null || person.type().isBlank()
                    ? PERSON_FALLBACK_CATEGORY
                    : person.type();
            if (person.role() != null && !person.role().isBlank()) {
                tags.add(Tag.of(category + ":" + person.name() + " (" + person.role() + ")"));
            }
            tags.add(Tag.of(category + ":" + person.name()));
        }
        return tags;
    }

    /**
     * Chapters become timeline tags running until the next chapter, the last
     * one until the end of the video.
     */
    private static List<Tag> chapters(List<JellyfinChapter> chapters, Long runTimeTicks) {
        List<Tag> tags = new ArrayList<>();
        for (int i = 0; i < chapters.size(); i++) {
            JellyfinChapter chapter = chapters.get(i);
            long endTicks;
            if (i + 1 < chapters.size()) {
                endTicks = chapters.get(i + 1).startPositionTicks();
            } else if (runTimeTicks != null) {
                endTicks = runTimeTicks;
            } else {
                endTicks = chapter.startPositionTicks();
            }
            String name = chapter.name() == null || chapter.name().isBlank() ? "Chapter " + (i + 1) : chapter.name();
            tags.add(Tag.spanning(
                    "Chapter:" + name,
                    Ticks.toMillis(chapter.startPositionTicks()),
                    Ticks.toMillis(Math.max(endTicks, chapter.startPositionTicks()))));
        }
        return tags;
    }

    private static List<String> studios(JellyfinItem item) {
        if (item.isEpisode() && item.seriesStudio() != null) {
            return List.of(item.seriesStudio());
        }
        return item.studios();
    }

    private static List<String> single(String value) {
        return value == null ? List.of() : List.of(value);
    }

    /**
     * One tag category and how to read its values from an item.
     *
     * @param category tag prefix
     * @param values reads the values, empty when the field is missing
     */
    public record Rule(String category, Function<JellyfinItem, List<String>> values) {}
}
