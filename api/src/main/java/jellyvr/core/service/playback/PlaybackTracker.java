package jellyvr.core.service.playback;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.core.model.common.AuthExpiredException;
import jellyvr.core.model.jellyfin.ProgressReport;
import jellyvr.core.model.playback.PlaybackOutcome;
import jellyvr.core.model.playback.PlaybackOutcome.Disposition;
import jellyvr.core.model.playback.PlaybackReport;
import jellyvr.core.model.playback.PlaybackState;
import jellyvr.core.model.store.StoreKey;
import jellyvr.core.port.in.PlaybackTracking;
import jellyvr.core.port.in.SessionManagement;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.port.out.JellyfinUpstream;
import jellyvr.core.service.store.RecordStore;

/**
 * Keeps the last known playback position per session and item, and relays
 * changes to Jellyfin.
 *
 * <p>Reports are merged last-writer-wins through a compare-and-swap on the
 * state record, so concurrent reports for the same item never interleave. The
 * relay to Jellyfin is detached from the caller: the player gets its answer as
 * soon as the state is durable, whatever Jellyfin does.
 */
@ApplicationScoped
public class PlaybackTracker implements PlaybackTracking {

    private static final Logger LOG = Logger.getLogger(PlaybackTracker.class);

    private final RecordStore records;
    private final JellyfinUpstream jellyfin;
    private final SessionManagement sessions;
    private final GatewayMetrics metrics;

    @Inject
    public PlaybackTracker(
            RecordStore records, JellyfinUpstream jellyfin, SessionManagement sessions, GatewayMetrics metrics) {
        this.records = records;
        this.jellyfin = jellyfin;
        this.sessions = sessions;
        this.metrics = metrics;
    }

    @Override
    public Uni<PlaybackOutcome> report(PlaybackReport report) {
        PlaybackState candidate = PlaybackState.from(report);
        StoreKey key = StoreKey.playback(report.sessionId(), report.itemId());
        return records.modify(key, PlaybackState.class, current -> {
                    if (current.filter(candidate::equals).isPresent()) {
                        return Optional.empty();
                    }
                    return candidate.supersedes(current.orElse(null)) ? Optional.of(candidate) : Optional.empty();
                })
                .map(update -> {
                    PlaybackState stored = update.current().orElse(candidate);
                    Disposition disposition;
                    if (update.written()) {
                        disposition = Disposition.APPLIED;
                    } else if (stored.equals(candidate)) {
                        disposition = Disposition.DUPLICATE;
                    } else {
                        disposition = Disposition.STALE;
                    }
                    metrics.recordPlaybackReport(disposition.name().toLowerCase());
                    LOG.debugf(
                            "Playback %s for item %s at %d ticks: %s",
                            report.kind(), report.itemId(), report.positionTicks(), disposition);
                    return new PlaybackOutcome(disposition, stored);
                })
                .invoke(outcome -> {
                    if (outcome.applied()) {
                        relay(report);
                    }
                });
    }

    @Override
    public Uni<Optional<PlaybackState>> state(String sessionId, String itemId) {
        return records.find(StoreKey.playback(sessionId, itemId), PlaybackState.class);
    }

    private void relay(PlaybackReport report) {
        ProgressReport progress = new ProgressReport(
                report.itemId(), report.kind(), report.positionTicks(), report.paused(), report.playSessionId());
        sessions.findSession(report.sessionId())
                .flatMap(session -> session.map(s -> jellyfin.reportProgress(s.jellyfinUser(), progress))
                        .orElseGet(() -> {
                            LOG.debugf("Session of playback report is gone, not relaying item %s", report.itemId());
                            return Uni.createFrom().voidItem();
                        }))
                .subscribe()
                .with(
                        ignored -> metrics.recordRelay(true),
                        error -> {
                            metrics.recordRelay(false);
                            if (error instanceof AuthExpiredException) {
                                LOG.warn("Jellyfin rejected the token of a playing session, logging it out");
                                invalidate(report.sessionId());
                            } else {
                                LOG.warnf(
                                        "Failed to relay playback %s of item %s: %s",
                                        report.kind(), report.itemId(), error.getMessage());
                            }
                        });
    }

    private void invalidate(String sessionId) {
        sessions.invalidateSession(sessionId)
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Invalidated session after rejected relay"),
                        error -> LOG.warnf("Failed to invalidate session: %s", error.getMessage()));
    }
}
