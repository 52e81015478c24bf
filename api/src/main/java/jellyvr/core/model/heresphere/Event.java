package jellyvr.core.model.heresphere;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Playback event posted by HereSphere.
 *
 * @param username login username
 * @param id video link the event refers to
 * @param title video title
 * @param event event type
 * @param time playback position in milliseconds
 * @param speed playback speed
 * @param utc client wall clock in epoch milliseconds
 * @param connectionKey key of a synchronized peripheral, unused
 */
public record Event(
        @JsonProperty("username") String username,
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("event") EventType event,
        @JsonProperty("time") double time,
        @JsonProperty("speed") double speed,
        @JsonProperty("utc") double utc,
        @JsonProperty("connectionKey") String connectionKey) {}
