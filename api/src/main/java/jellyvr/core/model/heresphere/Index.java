package jellyvr.core.model.heresphere;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Library index returned from {@code POST /heresphere}.
 *
 * @param access 1 when the credentials were accepted, -1 otherwise
 * @param library library tabs
 */
public record Index(@JsonProperty("access") int access, @JsonProperty("library") List<Library> library) {

    public static final int ACCESS_GRANTED = 1;
    public static final int ACCESS_DENIED = -1;

    public Index {
        library = library == null ? List.of() : List.copyOf(library);
    }

    public static Index granted(List<Library> library) {
        return new Index(ACCESS_GRANTED, library);
    }

    /**
     * Index shown when the player has no valid credentials.
     */
    public static Index denied() {
        return new Index(ACCESS_DENIED, List.of(new Library("Login pls", List.of())));
    }
}
