package jellyvr.core.model.store;

import java.util.Objects;

/**
 * Address of one durable record: an entity type plus its natural identifier.
 *
 * <p>Rendered as {@code <entity>:<id>}. Identifiers are opaque and may contain
 * any character; storage adapters are responsible for encoding them safely.
 *
 * @param entity record family (session, quickconnect, ...)
 * @param id natural identifier within the family
 */
public record StoreKey(String entity, String id) {

    public static final String SESSION = "session";
    public static final String SESSION_BY_USERNAME = "session-user";
    public static final String QUICK_CONNECT = "quickconnect";
    public static final String PLAYBACK = "playback";

    public StoreKey {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(id, "id");
        if (entity.isBlank() || entity.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Invalid entity type: " + entity);
        }
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Record id must not be empty");
        }
    }

    public static StoreKey session(String sessionId) {
        return new StoreKey(SESSION, sessionId);
    }

    public static StoreKey sessionByUsername(String username) {
        return new StoreKey(SESSION_BY_USERNAME, username);
    }

    public static StoreKey quickConnect(String secret) {
        return new StoreKey(QUICK_CONNECT, secret);
    }

    public static StoreKey playback(String sessionId, String itemId) {
        return new StoreKey(PLAYBACK, sessionId + ":" + itemId);
    }

    /**
     * Parses the rendered form produced by {@link #toString()}.
     */
    public static StoreKey parse(String rendered) {
        int separator = rendered.indexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("Not a store key: " + rendered);
        }
        return new StoreKey(rendered.substring(0, separator), rendered.substring(separator + 1));
    }

    @Override
    public String toString() {
        return entity + ":" + id;
    }
}
