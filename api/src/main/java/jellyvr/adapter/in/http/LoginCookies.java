package jellyvr.adapter.in.http;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.NewCookie;

import jellyvr.config.CookieConfigMapping;
import jellyvr.core.config.QuickConnectConfig;

/**
 * Creates, reads and clears the login and session cookies.
 */
@ApplicationScoped
public class LoginCookies {

    private final CookieConfigMapping config;
    private final Duration loginMaxAge;

    @Inject
    public LoginCookies(CookieConfigMapping config, QuickConnectConfig quickConnectConfig) {
        this.config = config;
        this.loginMaxAge = quickConnectConfig.timeout();
    }

    public Optional<String> loginSecret(Map<String, Cookie> cookies) {
        return value(cookies, config.loginName());
    }

    public Optional<String> sessionId(Map<String, Cookie> cookies) {
        return value(cookies, config.sessionName());
    }

    public NewCookie login(String secret) {
        return cookie(config.loginName(), secret, loginMaxAge.toSeconds());
    }

    public NewCookie clearLogin() {
        return cookie(config.loginName(), "", 0);
    }

    public NewCookie session(String sessionId) {
        return cookie(config.sessionName(), sessionId, config.sessionMaxAge().toSeconds());
    }

    public NewCookie clearSession() {
        return cookie(config.sessionName(), "", 0);
    }

    private NewCookie cookie(String name, String value, long maxAge) {
        final var builder = new NewCookie.Builder(name)
                .value(value)
                .path(config.path())
                .httpOnly(true)
                .secure(config.secure())
                .sameSite(parseSameSite(config.sameSite()))
                .maxAge((int) Math.min(maxAge, Integer.MAX_VALUE));
        config.domain().ifPresent(builder::domain);
        return builder.build();
    }

    private static Optional<String> value(Map<String, Cookie> cookies, String name) {
        final var cookie = cookies.get(name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    private static NewCookie.SameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase()) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
