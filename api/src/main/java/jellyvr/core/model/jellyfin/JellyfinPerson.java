package jellyvr.core.model.jellyfin;

/**
 * Cast or crew member credited on an item.
 *
 * @param name person name
 * @param role character or job, may be null
 * @param type Jellyfin person type (Actor, Director, Writer, ...)
 */
public record JellyfinPerson(String name, String role, String type) {}
