package jellyvr.core.model.heresphere;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Playback events HereSphere posts to the event server. Serialized as their
 * numeric code.
 */
public enum EventType {
    OPEN(0),
    PLAY(1),
    PAUSE(2),
    CLOSE(3);

    private final int code;

    EventType(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    @JsonCreator
    public static EventType fromCode(int code) {
        for (EventType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown HereSphere event type: " + code);
    }
}
