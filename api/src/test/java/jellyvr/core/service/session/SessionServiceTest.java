package jellyvr.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import jellyvr.adapter.out.storage.memory.InMemoryKeyValueStore;
import jellyvr.core.model.session.Session;
import jellyvr.core.model.session.UsernameIndexEntry;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.service.store.RecordStore;
import jellyvr.core.util.SecureHash;
import jellyvr.mock.MutableClock;

@DisplayName("SessionService")
class SessionServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private RecordStore records;
    private GatewayMetrics metrics;
    private MutableClock clock;
    private SessionService service;

    @BeforeEach
    void setUp() {
        records = new RecordStore(new InMemoryKeyValueStore(), new ObjectMapper(), 3);
        metrics = mock(GatewayMetrics.class);
        clock = new MutableClock(START);
        service = new SessionService(records, metrics, clock);
    }

    private Session store(String sessionId, String username, String password) {
        final var salt = "salt-" + sessionId;
        final var session = new Session(
                sessionId, "u-" + username, "tok-" + sessionId, username, SecureHash.saltedSha256(salt, password),
                salt, "dev", START, START);
        records.save(StoreKey.session(sessionId), session).await().indefinitely();
        records.save(StoreKey.sessionByUsername(username), new UsernameIndexEntry(username, sessionId))
                .await()
                .indefinitely();
        return session;
    }

    @Nested
    @DisplayName("authenticateLocal")
    class AuthenticateLocalTests {

        @Test
        @DisplayName("should resolve the session for matching credentials")
        void shouldAuthenticate() {
            store("s1", "alice", "secretpw");

            final var result = service.authenticateLocal("alice", "secretpw").await().indefinitely();

            assertTrue(result.isPresent());
            assertEquals("s1", result.get().sessionId());
            assertEquals("tok-s1", result.get().jellyfinAccessToken());
            verify(metrics).recordLocalAuthentication(true);
        }

        @Test
        @DisplayName("should reject a wrong password")
        void shouldRejectWrongPassword() {
            store("s1", "alice", "secretpw");

            assertTrue(service.authenticateLocal("alice", "wrongpw").await().indefinitely().isEmpty());
            verify(metrics).recordLocalAuthentication(false);
        }

        @Test
        @DisplayName("should reject an unknown username")
        void shouldRejectUnknownUsername() {
            assertTrue(service.authenticateLocal("bob", "secretpw").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should reject empty credentials without reading the store")
        void shouldRejectEmptyCredentials() {
            store("s1", "alice", "secretpw");

            assertTrue(service.authenticateLocal("alice", "").await().indefinitely().isEmpty());
            assertTrue(service.authenticateLocal("", "secretpw").await().indefinitely().isEmpty());
            assertTrue(service.authenticateLocal(null, null).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should treat an index entry pointing at a removed session as unknown")
        void shouldIgnoreDanglingIndex() {
            store("s1", "alice", "secretpw");
            service.invalidateSession("s1").await().indefinitely();

            assertTrue(service.authenticateLocal("alice", "secretpw").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should only rewrite lastUsedAt once per resolution interval")
        void shouldThrottleLastUsedWrites() {
            store("s1", "alice", "secretpw");

            clock.advance(Duration.ofSeconds(30));
            final var early = service.authenticateLocal("alice", "secretpw").await().indefinitely();
            assertEquals(START, early.get().lastUsedAt());

            clock.advance(SessionService.LAST_USED_RESOLUTION);
            final var later = service.authenticateLocal("alice", "secretpw").await().indefinitely();
            assertEquals(clock.instant(), later.get().lastUsedAt());

            final var stored = records.find(StoreKey.session("s1"), Session.class).await().indefinitely();
            assertEquals(clock.instant(), stored.get().lastUsedAt());
        }
    }

    @Nested
    @DisplayName("findSession and invalidateSession")
    class LookupTests {

        @Test
        @DisplayName("should find a stored session by id")
        void shouldFindSession() {
            final var session = store("s1", "alice", "secretpw");

            assertEquals(session, service.findSession("s1").await().indefinitely().orElseThrow());
        }

        @Test
        @DisplayName("should return empty for a missing or blank id")
        void shouldReturnEmptyForMissingId() {
            assertTrue(service.findSession("nope").await().indefinitely().isEmpty());
            assertTrue(service.findSession("").await().indefinitely().isEmpty());
            assertTrue(service.findSession(null).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should remove an invalidated session")
        void shouldInvalidate() {
            store("s1", "alice", "secretpw");

            service.invalidateSession("s1").await().indefinitely();

            assertTrue(service.findSession("s1").await().indefinitely().isEmpty());
        }
    }
}
