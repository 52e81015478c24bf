package jellyvr.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import jellyvr.adapter.out.storage.memory.InMemoryKeyValueStore;
import jellyvr.core.config.QuickConnectConfig;
import jellyvr.core.model.common.StoreUnavailableException;
import jellyvr.core.model.common.UpstreamUnavailableException;
import jellyvr.core.model.jellyfin.JellyfinUser;
import jellyvr.core.model.jellyfin.QuickConnectInitiation;
import jellyvr.core.model.jellyfin.QuickConnectStatus;
import jellyvr.core.model.session.LoginStatus;
import jellyvr.core.model.session.QuickConnectRequest;
import jellyvr.core.model.session.QuickConnectRequestStatus;
import jellyvr.core.model.session.Session;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.port.out.JellyfinUpstream;
import jellyvr.core.port.out.KeyValueStore;
import jellyvr.core.service.store.RecordStore;
import jellyvr.mock.MutableClock;

@DisplayName("LoginService")
class LoginServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration WINDOW = Duration.ofMinutes(10);

    private JellyfinUpstream jellyfin;
    private GatewayMetrics metrics;
    private InMemoryKeyValueStore backend;
    private RecordStore records;
    private MutableClock clock;
    private QuickConnectConfig config;
    private LoginService service;
    private SessionService sessions;

    @BeforeEach
    void setUp() {
        jellyfin = mock(JellyfinUpstream.class);
        metrics = mock(GatewayMetrics.class);
        backend = new InMemoryKeyValueStore();
        records = new RecordStore(backend, new ObjectMapper(), 5);
        clock = new MutableClock(START);

        config = mock(QuickConnectConfig.class);
        when(config.timeout()).thenReturn(WINDOW);
        when(config.pollTimeout()).thenReturn(Duration.ofSeconds(2));
        when(config.pollRetries()).thenReturn(2);
        when(config.pollBackoff()).thenReturn(Duration.ofMillis(10));

        when(jellyfin.reportCapabilities(any())).thenReturn(Uni.createFrom().voidItem());
        when(jellyfin.logout(any())).thenReturn(Uni.createFrom().voidItem());

        service = new LoginService(jellyfin, records, new CredentialGenerator(6), config, metrics, clock);
        sessions = new SessionService(records, metrics, clock);
    }

    private void initiates(String secret, String code) {
        when(jellyfin.quickConnectInitiate())
                .thenReturn(Uni.createFrom().item(new QuickConnectInitiation(secret, code)));
    }

    private Optional<QuickConnectRequest> request(String secret) {
        return records.find(StoreKey.quickConnect(secret), QuickConnectRequest.class).await().indefinitely();
    }

    private LoginStatus poll(String secret) {
        return service.pollLogin(secret).await().indefinitely();
    }

    @Nested
    @DisplayName("startLogin")
    class StartLoginTests {

        @Test
        @DisplayName("should persist a pending request expiring after the window")
        void shouldPersistPendingRequest() {
            initiates("secret-1", "ABC123");

            final var started = service.startLogin(Optional.empty()).await().indefinitely();

            assertEquals("ABC123", started.displayCode());
            final var stored = request("secret-1").orElseThrow();
            assertEquals(QuickConnectRequestStatus.PENDING, stored.status());
            assertEquals(START.plus(WINDOW), stored.expiresAt());
        }

        @Test
        @DisplayName("should expire the browser's previous pending request")
        void shouldSupersedePreviousRequest() {
            initiates("secret-1", "AAA111");
            service.startLogin(Optional.empty()).await().indefinitely();
            initiates("secret-2", "BBB222");

            service.startLogin(Optional.of("secret-1")).await().indefinitely();

            final var previous = request("secret-1").orElseThrow();
            assertEquals(QuickConnectRequestStatus.EXPIRED, previous.status());
            assertEquals("secret-2", previous.supersededBy());
            assertEquals(LoginStatus.State.EXPIRED, poll("secret-1").state());
            verify(jellyfin, never()).quickConnectPoll(eq("secret-1"), anyString());
            verify(metrics).recordLogin(QuickConnectRequest.REASON_SUPERSEDED);
        }

        @Test
        @DisplayName("should fail when Jellyfin hands out a secret that is already in use")
        void shouldRejectReusedSecret() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();

            assertThrows(
                    IllegalStateException.class,
                    () -> service.startLogin(Optional.empty()).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("pollLogin")
    class PollLoginTests {

        @Test
        @DisplayName("should create a session on the third poll and accept its password locally")
        void shouldApproveOnThirdPoll() {
            initiates("secret-1", "ABC123");
            final var started = service.startLogin(Optional.empty()).await().indefinitely();
            assertEquals("ABC123", started.displayCode());
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(
                            Uni.createFrom().item(QuickConnectStatus.PENDING),
                            Uni.createFrom().item(QuickConnectStatus.PENDING),
                            Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok1")));

            assertEquals(LoginStatus.pending("ABC123"), poll("secret-1"));
            assertEquals(LoginStatus.pending("ABC123"), poll("secret-1"));
            final var approved = poll("secret-1");

            assertTrue(approved.isApproved());
            final var identity = approved.identity();
            assertEquals("alice", identity.username());
            assertEquals(6, identity.password().length());

            final var session = sessions.authenticateLocal("alice", identity.password())
                    .await()
                    .indefinitely()
                    .orElseThrow();
            assertEquals(identity.sessionId(), session.sessionId());
            assertEquals("u1", session.jellyfinUserId());
            assertEquals("tok1", session.jellyfinAccessToken());
            assertEquals(LoginService.deviceIdFor("secret-1"), session.deviceId());
            verify(jellyfin, times(3)).quickConnectPoll("secret-1", LoginService.deviceIdFor("secret-1"));
            verify(jellyfin, timeout(1000)).reportCapabilities(session.jellyfinUser());
            verify(metrics).recordSessionCreated();
        }

        @Test
        @DisplayName("should replace the earlier session of the same user with a new password")
        void shouldReplaceEarlierSession() {
            initiates("secret-1", "AAA111");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok1")));
            final var first = poll("secret-1").identity();

            initiates("secret-2", "BBB222");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-2"), anyString()))
                    .thenReturn(Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok2")));
            final var second = poll("secret-2").identity();

            assertNotEquals(first.sessionId(), second.sessionId());
            assertNotEquals(first.password(), second.password());
            assertTrue(sessions.findSession(first.sessionId()).await().indefinitely().isEmpty());
            assertTrue(sessions.authenticateLocal("alice", first.password())
                    .await()
                    .indefinitely()
                    .isEmpty());
            assertTrue(sessions.authenticateLocal("alice", second.password())
                    .await()
                    .indefinitely()
                    .isPresent());
            verify(jellyfin, timeout(1000))
                    .logout(new JellyfinUser("u1", "tok1", LoginService.deviceIdFor("secret-1")));
        }

        @Test
        @DisplayName("should give concurrent pollers the same identity and keep one session")
        void shouldSettleConcurrentPollsOnce() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(Uni.createFrom()
                            .item(QuickConnectStatus.approved("u1", "alice", "tok1"))
                            .onItem()
                            .delayIt()
                            .by(Duration.ofMillis(100)));

            final var first = service.pollLogin("secret-1").subscribeAsCompletionStage();
            final var second = service.pollLogin("secret-1").subscribeAsCompletionStage();
            final var a = first.toCompletableFuture().join();
            final var b = second.toCompletableFuture().join();

            assertTrue(a.isApproved());
            assertEquals(a, b);
            // request, session and username index
            assertEquals(3, backend.size());
            verify(jellyfin, timeout(1000).times(1)).logout(any());
            verify(metrics, times(1)).recordSessionCreated();
        }

        @Test
        @DisplayName("should keep returning the recorded identity once authorized")
        void shouldRepeatApproval() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok1")));

            final var approved = poll("secret-1");

            assertEquals(approved, poll("secret-1"));
            verify(jellyfin, times(1)).quickConnectPoll(anyString(), anyString());
        }

        @Test
        @DisplayName("should expire a request past its window without asking Jellyfin")
        void shouldExpireAfterWindow() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();

            clock.advance(WINDOW);

            assertEquals(LoginStatus.expired("ABC123"), poll("secret-1"));
            assertEquals(LoginStatus.expired("ABC123"), poll("secret-1"));
            assertEquals(QuickConnectRequest.REASON_TIMEOUT, request("secret-1").orElseThrow().expiredReason());
            verify(jellyfin, never()).quickConnectPoll(anyString(), anyString());
        }

        @Test
        @DisplayName("should ignore an approval observed after the window and revoke its token")
        void shouldIgnoreLateApproval() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();
            clock.advance(WINDOW.minusSeconds(1));
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString())).thenAnswer(invocation -> {
                clock.advance(Duration.ofSeconds(2));
                return Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok1"));
            });

            assertEquals(LoginStatus.State.EXPIRED, poll("secret-1").state());

            assertEquals(1, backend.size());
            verify(jellyfin, timeout(1000)).logout(any());
            verify(metrics, never()).recordSessionCreated();
        }

        @Test
        @DisplayName("should expire a request that Jellyfin rejected")
        void shouldExpireRejectedRequest() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(Uni.createFrom().item(QuickConnectStatus.REJECTED));

            assertEquals(LoginStatus.expired("ABC123"), poll("secret-1"));
            assertEquals(QuickConnectRequest.REASON_REJECTED, request("secret-1").orElseThrow().expiredReason());
            verify(metrics).recordLogin(QuickConnectRequest.REASON_REJECTED);
        }

        @Test
        @DisplayName("should retry a poll while Jellyfin is unavailable")
        void shouldRetryUnavailableUpstream() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();
            final var attempts = new AtomicInteger();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString())).thenReturn(Uni.createFrom().item(() -> {
                if (attempts.incrementAndGet() <= 2) {
                    throw new UpstreamUnavailableException("connection refused", 0);
                }
                return QuickConnectStatus.PENDING;
            }));

            assertEquals(LoginStatus.pending("ABC123"), poll("secret-1"));
            assertEquals(3, attempts.get());
        }

        @Test
        @DisplayName("should surface an outage once retries are exhausted and keep the request pending")
        void shouldSurfaceOutage() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(Uni.createFrom().failure(new UpstreamUnavailableException("down", 503)));

            assertThrows(UpstreamUnavailableException.class, () -> poll("secret-1"));
            assertEquals(QuickConnectRequestStatus.PENDING, request("secret-1").orElseThrow().status());
        }

        @Test
        @DisplayName("should report an unknown secret")
        void shouldReportUnknown() {
            assertEquals(LoginStatus.unknown(), poll("missing"));
        }
    }

    @Nested
    @DisplayName("Interrupted login")
    class InterruptedLoginTests {

        private LoginService flakyService;

        @BeforeEach
        void failFirstIndexWrite() {
            final var flaky = new FailingOnceStore(backend, StoreKey.SESSION_BY_USERNAME);
            flakyService = new LoginService(
                    jellyfin, new RecordStore(flaky, new ObjectMapper(), 5), new CredentialGenerator(6), config,
                    metrics, clock);
            initiates("secret-1", "AAA111");
            flakyService.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok1")));
        }

        @Test
        @DisplayName("should publish the session on the next poll after the index write failed")
        void shouldFinishPublication() {
            assertThrows(
                    StoreUnavailableException.class,
                    () -> flakyService.pollLogin("secret-1").await().indefinitely());
            assertEquals(QuickConnectRequestStatus.AUTHORIZED, request("secret-1").orElseThrow().status());
            verify(metrics, never()).recordSessionCreated();

            final var approved = flakyService.pollLogin("secret-1").await().indefinitely();

            assertTrue(approved.isApproved());
            final var session = sessions.authenticateLocal("alice", approved.identity().password())
                    .await()
                    .indefinitely()
                    .orElseThrow();
            assertEquals(approved.identity().sessionId(), session.sessionId());
            verify(metrics, times(1)).recordSessionCreated();
            verify(jellyfin, timeout(1000)).reportCapabilities(session.jellyfinUser());
            verify(jellyfin, times(1)).quickConnectPoll(anyString(), anyString());
        }

        @Test
        @DisplayName("should drop the unpublished session when the user logged in again since")
        void shouldYieldToNewerLogin() {
            assertThrows(
                    StoreUnavailableException.class,
                    () -> flakyService.pollLogin("secret-1").await().indefinitely());
            final var stranded = request("secret-1").orElseThrow().identity();

            clock.advance(Duration.ofSeconds(1));
            initiates("secret-2", "BBB222");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-2"), anyString()))
                    .thenReturn(Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok2")));
            final var newer = poll("secret-2").identity();

            assertEquals(LoginStatus.expired("AAA111"), flakyService.pollLogin("secret-1").await().indefinitely());
            assertTrue(sessions.findSession(stranded.sessionId()).await().indefinitely().isEmpty());
            assertTrue(sessions.authenticateLocal("alice", newer.password())
                    .await()
                    .indefinitely()
                    .isPresent());
            verify(jellyfin, timeout(1000))
                    .logout(new JellyfinUser("u1", "tok1", LoginService.deviceIdFor("secret-1")));
        }
    }

    @Nested
    @DisplayName("completeLogin")
    class CompleteLoginTests {

        @Test
        @DisplayName("should drop an authorized request and its password reveal")
        void shouldDropAuthorizedRequest() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();
            when(jellyfin.quickConnectPoll(eq("secret-1"), anyString()))
                    .thenReturn(Uni.createFrom().item(QuickConnectStatus.approved("u1", "alice", "tok1")));
            final var identity = poll("secret-1").identity();

            service.completeLogin("secret-1").await().indefinitely();

            assertTrue(request("secret-1").isEmpty());
            assertEquals(LoginStatus.unknown(), poll("secret-1"));
            assertTrue(records.find(StoreKey.session(identity.sessionId()), Session.class)
                    .await()
                    .indefinitely()
                    .isPresent());
        }

        @Test
        @DisplayName("should leave a pending request in place")
        void shouldKeepPendingRequest() {
            initiates("secret-1", "ABC123");
            service.startLogin(Optional.empty()).await().indefinitely();

            service.completeLogin("secret-1").await().indefinitely();

            assertTrue(request("secret-1").isPresent());
        }
    }

    @Test
    @DisplayName("should derive a stable device id per secret")
    void shouldDeriveStableDeviceId() {
        assertEquals(LoginService.deviceIdFor("secret-1"), LoginService.deviceIdFor("secret-1"));
        assertNotEquals(LoginService.deviceIdFor("secret-1"), LoginService.deviceIdFor("secret-2"));
        assertTrue(LoginService.deviceIdFor("secret-1").startsWith("jellyvr-"));
    }

    /**
     * Delegating store whose first conditional write to one record family fails.
     */
    private static final class FailingOnceStore implements KeyValueStore {

        private final KeyValueStore delegate;
        private final String entity;
        private final AtomicBoolean failed = new AtomicBoolean();

        FailingOnceStore(KeyValueStore delegate, String entity) {
            this.delegate = delegate;
            this.entity = entity;
        }

        @Override
        public Uni<Optional<String>> get(StoreKey key) {
            return delegate.get(key);
        }

        @Override
        public Uni<Void> put(StoreKey key, String value) {
            return delegate.put(key, value);
        }

        @Override
        public Uni<Void> delete(StoreKey key) {
            return delegate.delete(key);
        }

        @Override
        public Uni<Boolean> compareAndSwap(StoreKey key, Optional<String> expected, String newValue) {
            if (key.entity().equals(entity) && failed.compareAndSet(false, true)) {
                return Uni.createFrom().failure(new StoreUnavailableException("compareAndSwap", "disk full"));
            }
            return delegate.compareAndSwap(key, expected, newValue);
        }
    }
}
