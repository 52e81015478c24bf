package jellyvr.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.core.config.QuickConnectConfig;
import jellyvr.core.model.common.UpstreamUnavailableException;
import jellyvr.core.model.jellyfin.JellyfinUser;
import jellyvr.core.model.jellyfin.QuickConnectStatus;
import jellyvr.core.model.session.LoginStatus;
import jellyvr.core.model.session.QuickConnectRequest;
import jellyvr.core.model.session.QuickConnectRequestStatus;
import jellyvr.core.model.session.Session;
import jellyvr.core.model.session.SessionIdentity;
import jellyvr.core.model.session.UsernameIndexEntry;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.model.store.StoreUpdate;
import jellyvr.core.port.in.LoginManagement;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.port.out.JellyfinUpstream;
import jellyvr.core.service.store.RecordStore;
import jellyvr.core.util.LogFormat;
import jellyvr.core.util.SecureHash;

/**
 * Drives the QuickConnect login state machine.
 *
 * <p>The request record is the single source of truth. Every transition is a
 * conditional write that only applies to a still pending request, so concurrent
 * polls of the same code race on the store, not on Jellyfin:
 * <ol>
 *   <li>a poll that sees an approval persists a fresh session under its own id;</li>
 *   <li>it then tries to move the request from pending to authorized;</li>
 *   <li>the winner publishes the session for its username, a loser removes its
 *       session, revokes its token and reports the winner's identity.</li>
 * </ol>
 */
@ApplicationScoped
public class LoginService implements LoginManagement {

    private static final Logger LOG = Logger.getLogger(LoginService.class);
    private static final int DEVICE_ID_HEX_CHARS = 32;
    private static final Duration MIN_POLL_WINDOW = Duration.ofMillis(1);

    private final JellyfinUpstream jellyfin;
    private final RecordStore records;
    private final CredentialGenerator credentialGenerator;
    private final QuickConnectConfig config;
    private final GatewayMetrics metrics;
    private final Clock clock;

    @Inject
    public LoginService(
            JellyfinUpstream jellyfin,
            RecordStore records,
            CredentialGenerator credentialGenerator,
            QuickConnectConfig config,
            GatewayMetrics metrics) {
        this(jellyfin, records, credentialGenerator, config, metrics, Clock.systemUTC());
    }

    LoginService(
            JellyfinUpstream jellyfin,
            RecordStore records,
            CredentialGenerator credentialGenerator,
            QuickConnectConfig config,
            GatewayMetrics metrics,
            Clock clock) {
        this.jellyfin = jellyfin;
        this.records = records;
        this.credentialGenerator = credentialGenerator;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<QuickConnectRequest> startLogin(Optional<String> previousSecret) {
        return jellyfin.quickConnectInitiate().flatMap(initiation -> {
            Instant now = clock.instant();
            QuickConnectRequest request = QuickConnectRequest.pending(
                    initiation.secret(), initiation.code(), now, now.plus(config.timeout()));
            return records.insertIfAbsent(StoreKey.quickConnect(request.secret()), request)
                    .flatMap(inserted -> {
                        if (!inserted) {
                            return Uni.createFrom()
                                    .<QuickConnectRequest>failure(new IllegalStateException(
                                            "Jellyfin reused QuickConnect secret for code " + request.displayCode()));
                        }
                        LOG.infof("Started QuickConnect login with code %s", request.displayCode());
                        return supersede(previousSecret, request.secret()).replaceWith(request);
                    });
        });
    }

    @Override
    public Uni<LoginStatus> pollLogin(String secret) {
        StoreKey key = StoreKey.quickConnect(secret);
        return records.find(key, QuickConnectRequest.class).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(LoginStatus.unknown());
            }
            QuickConnectRequest request = found.get();
            if (request.status() == QuickConnectRequestStatus.AUTHORIZED) {
                return confirmPublished(request);
            }
            if (!request.isPending()) {
                return Uni.createFrom().item(LoginStatus.of(request));
            }
            if (request.isPastWindow(clock.instant())) {
                return expire(key, QuickConnectRequest.REASON_TIMEOUT);
            }
            return pollUpstream(request).flatMap(status -> switch (status.state()) {
                case PENDING -> Uni.createFrom().item(LoginStatus.pending(request.displayCode()));
                case REJECTED -> expire(key, QuickConnectRequest.REASON_REJECTED);
                case APPROVED -> onApproved(request, status);
            });
        });
    }

    @Override
    public Uni<Void> completeLogin(String secret) {
        StoreKey key = StoreKey.quickConnect(secret);
        return records.find(key, QuickConnectRequest.class).flatMap(found -> {
            if (found.isEmpty() || found.get().isPending()) {
                return Uni.createFrom().voidItem();
            }
            LOG.debugf("Removing consumed QuickConnect request %s", found.get().displayCode());
            return records.remove(key);
        });
    }

    private Uni<Void> supersede(Optional<String> previousSecret, String newSecret) {
        if (previousSecret.isEmpty() || previousSecret.get().equals(newSecret)) {
            return Uni.createFrom().voidItem();
        }
        return records.modify(
                        StoreKey.quickConnect(previousSecret.get()),
                        QuickConnectRequest.class,
                        current -> current.filter(QuickConnectRequest::isPending).map(r -> r.supersede(newSecret)))
                .invoke(update -> {
                    if (update.written()) {
                        metrics.recordLogin(QuickConnectRequest.REASON_SUPERSEDED);
                        LOG.debugf("Superseded QuickConnect code %s", update.previous().get().displayCode());
                    }
                })
                .replaceWithVoid();
    }

    private Uni<QuickConnectStatus> pollUpstream(QuickConnectRequest request) {
        Duration remaining = Duration.between(clock.instant(), request.expiresAt());
        if (remaining.compareTo(MIN_POLL_WINDOW) < 0) {
            remaining = MIN_POLL_WINDOW;
        }
        Uni<QuickConnectStatus> attempt = jellyfin.quickConnectPoll(request.secret(), deviceIdFor(request.secret()))
                .ifNoItem()
                .after(config.pollTimeout())
                .failWith(() -> new UpstreamUnavailableException(
                        "QuickConnect poll timed out after " + config.pollTimeout(), 0));
        if (config.pollRetries() > 0) {
            Duration backoff = config.pollBackoff();
            attempt = attempt.onFailure(UpstreamUnavailableException.class)
                    .retry()
                    .withBackOff(backoff, backoff.multipliedBy(8))
                    .atMost(config.pollRetries());
        }
        return attempt.ifNoItem()
                .after(remaining)
                .failWith(() -> new UpstreamUnavailableException(
                        "QuickConnect code " + request.displayCode() + " expired while polling", 0));
    }

    private Uni<LoginStatus> onApproved(QuickConnectRequest request, QuickConnectStatus approval) {
        JellyfinUser user =
                new JellyfinUser(approval.userId(), approval.accessToken(), deviceIdFor(request.secret()));
        Instant now = clock.instant();
        if (request.isPastWindow(now)) {
            LOG.infof("Ignoring approval of QuickConnect code %s that arrived after expiry", request.displayCode());
            revoke(user);
            return expire(StoreKey.quickConnect(request.secret()), QuickConnectRequest.REASON_TIMEOUT);
        }

        String password = credentialGenerator.password();
        String salt = credentialGenerator.salt();
        Session session = new Session(
                credentialGenerator.sessionId(),
                approval.userId(),
                approval.accessToken(),
                approval.userName(),
                SecureHash.saltedSha256(salt, password),
                salt,
                user.deviceId(),
                now,
                now);
        SessionIdentity identity = new SessionIdentity(session.sessionId(), session.localUsername(), password);

        return records.insertIfAbsent(StoreKey.session(session.sessionId()), session)
                .flatMap(inserted -> {
                    if (!inserted) {
                        return Uni.createFrom()
                                .<StoreUpdate<QuickConnectRequest>>failure(
                                        new IllegalStateException("Session id collision for a fresh session"));
                    }
                    return records.modify(
                            StoreKey.quickConnect(request.secret()),
                            QuickConnectRequest.class,
                            current -> current.filter(QuickConnectRequest::isPending)
                                    .filter(r -> !r.isPastWindow(now))
                                    .map(r -> r.authorize(identity)));
                })
                .flatMap(update -> update.written()
                        ? publish(session).replaceWith(LoginStatus.approved(identity))
                        : discard(session, update));
    }

    /**
     * Make the winning session reachable by username and retire the session it
     * replaces for the same Jellyfin user.
     */
    private Uni<Void> publish(Session session) {
        StoreKey indexKey = StoreKey.sessionByUsername(session.localUsername());
        UsernameIndexEntry entry = new UsernameIndexEntry(session.localUsername(), session.sessionId());
        return records.modify(indexKey, UsernameIndexEntry.class, current -> Optional.of(entry))
                .flatMap(update -> retireReplaced(update, session))
                .invoke(() -> {
                    metrics.recordSessionCreated();
                    metrics.recordLogin("approved");
                    LOG.infof(
                            "Created session %s for Jellyfin user %s",
                            LogFormat.abbreviate(session.sessionId()),
                            session.localUsername());
                    reportCapabilities(session.jellyfinUser());
                });
    }

    /**
     * An authorized request only reports its identity once the session is
     * reachable by username. A poll that failed after authorizing leaves the
     * index behind; the next poll publishes the session, unless a newer login
     * of the same user has taken its place in the meantime.
     */
    private Uni<LoginStatus> confirmPublished(QuickConnectRequest request) {
        SessionIdentity identity = request.identity();
        return records.find(StoreKey.sessionByUsername(identity.username()), UsernameIndexEntry.class)
                .flatMap(index -> {
                    Optional<String> indexed = index.map(UsernameIndexEntry::sessionId);
                    if (indexed.filter(identity.sessionId()::equals).isPresent()) {
                        return Uni.createFrom().item(LoginStatus.of(request));
                    }
                    return records.find(StoreKey.session(identity.sessionId()), Session.class)
                            .flatMap(own -> own.isEmpty()
                                    ? Uni.createFrom().item(LoginStatus.expired(request.displayCode()))
                                    : republish(request, own.get(), indexed));
                });
    }

    private Uni<LoginStatus> republish(QuickConnectRequest request, Session session, Optional<String> indexed) {
        Uni<Optional<Session>> current = indexed.isEmpty()
                ? Uni.createFrom().item(Optional.<Session>empty())
                : records.find(StoreKey.session(indexed.get()), Session.class);
        return current.flatMap(other -> {
            if (other.filter(o -> o.createdAt().isAfter(session.createdAt())).isPresent()) {
                LOG.infof("Dropping unpublished session %s, %s logged in again since",
                        LogFormat.abbreviate(session.sessionId()), session.localUsername());
                return records.remove(StoreKey.session(session.sessionId()))
                        .invoke(() -> revoke(session.jellyfinUser()))
                        .replaceWith(LoginStatus.expired(request.displayCode()));
            }
            LOG.infof("Publishing session %s left over from an interrupted login",
                    LogFormat.abbreviate(session.sessionId()));
            return publish(session).replaceWith(LoginStatus.of(request));
        });
    }

    private Uni<Void> retireReplaced(StoreUpdate<UsernameIndexEntry> update, Session session) {
        Optional<String> replaced = update.previous()
                .map(UsernameIndexEntry::sessionId)
                .filter(id -> !id.equals(session.sessionId()));
        if (replaced.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        StoreKey oldKey = StoreKey.session(replaced.get());
        return records.find(oldKey, Session.class).flatMap(old -> records.remove(oldKey)
                .invoke(() -> old.ifPresent(previous -> {
                    LOG.infof("Replaced earlier session of %s", previous.localUsername());
                    revoke(previous.jellyfinUser());
                })));
    }

    /**
     * Undo the work of a poll that lost the race and report what the winner stored.
     */
    private Uni<LoginStatus> discard(Session session, StoreUpdate<QuickConnectRequest> update) {
        LOG.debugf("Concurrent poll already settled QuickConnect request, discarding %s",
                LogFormat.abbreviate(session.sessionId()));
        return records.remove(StoreKey.session(session.sessionId()))
                .invoke(() -> revoke(session.jellyfinUser()))
                .map(ignored -> update.current().map(LoginStatus::of).orElseGet(LoginStatus::unknown));
    }

    private Uni<LoginStatus> expire(StoreKey key, String reason) {
        return records.modify(
                        key,
                        QuickConnectRequest.class,
                        current -> current.filter(QuickConnectRequest::isPending).map(r -> r.expire(reason)))
                .map(update -> {
                    if (update.written()) {
                        metrics.recordLogin(reason);
                        LOG.infof("QuickConnect code %s expired (%s)", update.current().get().displayCode(), reason);
                    }
                    return update.current().map(LoginStatus::of).orElseGet(LoginStatus::unknown);
                });
    }

    private void reportCapabilities(JellyfinUser user) {
        jellyfin.reportCapabilities(user)
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Reported capabilities for %s", user.userId()),
                        error -> LOG.warnf(
                                "Failed to report capabilities for %s: %s", user.userId(), error.getMessage()));
    }

    private void revoke(JellyfinUser user) {
        jellyfin.logout(user)
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Revoked redundant token for %s", user.userId()),
                        error -> LOG.warnf("Failed to revoke token for %s: %s", user.userId(), error.getMessage()));
    }

    /**
     * Jellyfin binds tokens to a device id; every poll of one request must use
     * the same one so the exchange is idempotent.
     */
    static String deviceIdFor(String secret) {
        return "jellyvr-" + SecureHash.truncatedSha256(secret, DEVICE_ID_HEX_CHARS);
    }
}
