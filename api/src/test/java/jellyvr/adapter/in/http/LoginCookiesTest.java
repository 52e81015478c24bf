package jellyvr.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.NewCookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import jellyvr.config.CookieConfigMapping;
import jellyvr.core.config.QuickConnectConfig;

@DisplayName("LoginCookies")
class LoginCookiesTest {

    private LoginCookies cookies;

    @BeforeEach
    void setUp() {
        final var config = mock(CookieConfigMapping.class);
        when(config.loginName()).thenReturn("jellyvr_login");
        when(config.sessionName()).thenReturn("jellyvr_session");
        when(config.path()).thenReturn("/");
        when(config.domain()).thenReturn(Optional.empty());
        when(config.secure()).thenReturn(true);
        when(config.sameSite()).thenReturn("strict");
        when(config.sessionMaxAge()).thenReturn(Duration.ofDays(400));
        final var quickConnect = mock(QuickConnectConfig.class);
        when(quickConnect.timeout()).thenReturn(Duration.ofMinutes(10));
        cookies = new LoginCookies(config, quickConnect);
    }

    @Test
    @DisplayName("should keep the login cookie for the QuickConnect window")
    void shouldCreateLoginCookie() {
        final var cookie = cookies.login("secret-1");

        assertEquals("jellyvr_login", cookie.getName());
        assertEquals("secret-1", cookie.getValue());
        assertEquals(600, cookie.getMaxAge());
        assertTrue(cookie.isHttpOnly());
        assertTrue(cookie.isSecure());
        assertEquals(NewCookie.SameSite.STRICT, cookie.getSameSite());
    }

    @Test
    @DisplayName("should keep the session cookie for the configured lifetime")
    void shouldCreateSessionCookie() {
        assertEquals(Duration.ofDays(400).toSeconds(), cookies.session("s1").getMaxAge());
    }

    @Test
    @DisplayName("should clear cookies by expiring them")
    void shouldClearCookies() {
        assertEquals(0, cookies.clearLogin().getMaxAge());
        assertEquals("", cookies.clearSession().getValue());
    }

    @Test
    @DisplayName("should read cookie values and ignore blank ones")
    void shouldReadCookies() {
        final var jar = Map.of(
                "jellyvr_login", new Cookie.Builder("jellyvr_login").value("secret-1").build(),
                "jellyvr_session", new Cookie.Builder("jellyvr_session").value(" ").build());

        assertEquals(Optional.of("secret-1"), cookies.loginSecret(jar));
        assertTrue(cookies.sessionId(jar).isEmpty());
        assertTrue(cookies.sessionId(Map.of()).isEmpty());
    }
}
