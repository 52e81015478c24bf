package jellyvr.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.core.model.session.Session;
import jellyvr.core.model.session.UsernameIndexEntry;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.in.SessionManagement;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.service.store.RecordStore;
import jellyvr.core.util.LogFormat;
import jellyvr.core.util.SecureHash;

/**
 * Implementation of session lookup and local credential checks.
 *
 * <p>Usernames resolve to sessions through the {@code session-user} index. An
 * index entry whose session is gone is treated like an unknown username; the
 * next login of that user overwrites it.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    /** {@code lastUsedAt} is only rewritten when it is older than this. */
    static final Duration LAST_USED_RESOLUTION = Duration.ofMinutes(1);

    private final RecordStore records;
    private final GatewayMetrics metrics;
    private final Clock clock;

    @Inject
    public SessionService(RecordStore records, GatewayMetrics metrics) {
        this(records, metrics, Clock.systemUTC());
    }

    SessionService(RecordStore records, GatewayMetrics metrics, Clock clock) {
        this.records = records;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<Optional<Session>> authenticateLocal(String username, String password) {
        if (username == null || username.isEmpty() || password == null || password.isEmpty()) {
            metrics.recordLocalAuthentication(false);
            return Uni.createFrom().item(Optional.empty());
        }
        return records.find(StoreKey.sessionByUsername(username), UsernameIndexEntry.class)
                .flatMap(entry -> {
                    if (entry.isEmpty()) {
                        return Uni.createFrom().item(Optional.<Session>empty());
                    }
                    return records.find(StoreKey.session(entry.get().sessionId()), Session.class);
                })
                .flatMap(session -> {
                    boolean valid = session.filter(s -> username.equals(s.localUsername()))
                            .filter(s -> SecureHash.matches(s.passwordHash(), s.passwordSalt(), password))
                            .isPresent();
                    metrics.recordLocalAuthentication(valid);
                    if (!valid) {
                        LOG.debugf("Rejected local credentials for %s", username);
                        return Uni.createFrom().item(Optional.<Session>empty());
                    }
                    return touch(session.get());
                });
    }

    @Override
    public Uni<Optional<Session>> findSession(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return records.find(StoreKey.session(sessionId), Session.class);
    }

    @Override
    public Uni<Void> invalidateSession(String sessionId) {
        LOG.infof("Invalidating session %s after Jellyfin rejected its token", LogFormat.abbreviate(sessionId));
        return records.remove(StoreKey.session(sessionId));
    }

    private Uni<Optional<Session>> touch(Session session) {
        Instant now = clock.instant();
        if (session.lastUsedAt() != null
                && session.lastUsedAt().plus(LAST_USED_RESOLUTION).isAfter(now)) {
            return Uni.createFrom().item(Optional.of(session));
        }
        return records.modify(
                        StoreKey.session(session.sessionId()),
                        Session.class,
                        current -> current.filter(s -> s.passwordHash().equals(session.passwordHash()))
                                .map(s -> s.withLastUsedAt(now)))
                .map(update -> update.current());
    }
}
