package jellyvr.adapter.in.heresphere;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to {@code POST /heresphere/auth}. HereSphere sends the token back in
 * the {@code auth-token} header on every later request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(@JsonProperty("access") int access, @JsonProperty("auth-token") String authToken) {

    static AuthResponse granted(String token) {
        return new AuthResponse(1, token);
    }

    static AuthResponse denied() {
        return new AuthResponse(-1, null);
    }
}
