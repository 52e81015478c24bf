package jellyvr.core.service.heresphere;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.core.cache.CaffeineLocalCache;
import jellyvr.core.cache.LocalCache;
import jellyvr.core.config.HereSphereConfig;
import jellyvr.core.model.common.AuthExpiredException;
import jellyvr.core.model.heresphere.Event;
import jellyvr.core.model.heresphere.EventType;
import jellyvr.core.model.heresphere.Index;
import jellyvr.core.model.heresphere.Request;
import jellyvr.core.model.heresphere.Scan;
import jellyvr.core.model.heresphere.TranslatedLibrary;
import jellyvr.core.model.heresphere.VideoData;
import jellyvr.core.model.jellyfin.JellyfinItem;
import jellyvr.core.model.jellyfin.Ticks;
import jellyvr.core.model.playback.PlaybackEventKind;
import jellyvr.core.model.playback.PlaybackOutcome;
import jellyvr.core.model.playback.PlaybackReport;
import jellyvr.core.model.playback.PlaybackState;
import jellyvr.core.model.session.Session;
import jellyvr.core.port.in.HereSphereGateway;
import jellyvr.core.port.in.PlaybackTracking;
import jellyvr.core.port.in.SessionManagement;
import jellyvr.core.port.out.GatewayMetrics;
import jellyvr.core.port.out.JellyfinUpstream;

/**
 * Implementation of the HereSphere API on top of Jellyfin.
 *
 * <p>Translated libraries are cached per user and gateway URL for
 * {@code jellyvr.heresphere.cache.ttl}; only metadata is cached, never media.
 * A token Jellyfin rejects invalidates the session and its cached library.
 */
@ApplicationScoped
public class HereSphereService implements HereSphereGateway {

    private static final Logger LOG = Logger.getLogger(HereSphereService.class);

    private final JellyfinUpstream jellyfin;
    private final SessionManagement sessions;
    private final PlaybackTracking playback;
    private final HereSphereTranslator translator;
    private final HereSphereConfig config;
    private final GatewayMetrics metrics;
    private final LocalCache<LibraryKey, TranslatedLibrary> libraries;
    private final Clock clock;

    @Inject
    public HereSphereService(
            JellyfinUpstream jellyfin,
            SessionManagement sessions,
            PlaybackTracking playback,
            HereSphereTranslator translator,
            HereSphereConfig config,
            GatewayMetrics metrics) {
        this(
                jellyfin,
                sessions,
                playback,
                translator,
                config,
                metrics,
                new CaffeineLocalCache<>(config.cache().ttl(), config.cache().maxEntries()),
                Clock.systemUTC());
    }

    HereSphereService(
            JellyfinUpstream jellyfin,
            SessionManagement sessions,
            PlaybackTracking playback,
            HereSphereTranslator translator,
            HereSphereConfig config,
            GatewayMetrics metrics,
            LocalCache<LibraryKey, TranslatedLibrary> libraries,
            Clock clock) {
        this.jellyfin = jellyfin;
        this.sessions = sessions;
        this.playback = playback;
        this.translator = translator;
        this.config = config;
        this.metrics = metrics;
        this.libraries = libraries;
        this.clock = clock;
    }

    @Override
    public Uni<Optional<Session>> resolveSession(Optional<String> authToken, Request request) {
        Optional<String> token = authToken.filter(t -> !t.isBlank());
        if (token.isPresent()) {
            return sessions.findSession(token.get());
        }
        if (request != null && request.hasCredentials()) {
            return sessions.authenticateLocal(request.username(), request.password());
        }
        return Uni.createFrom().item(Optional.empty());
    }

    @Override
    public Uni<Index> index(Session session, String gatewayUrl) {
        return library(session, gatewayUrl).map(library -> Index.granted(library.libraries()));
    }

    @Override
    public Uni<Scan> scan(Session session, String gatewayUrl) {
        return library(session, gatewayUrl).map(TranslatedLibrary::scan);
    }

    @Override
    public Uni<VideoData> video(Session session, String gatewayUrl, String itemId, boolean needsMediaSource) {
        TranslationContext context = new TranslationContext(gatewayUrl, session.jellyfinAccessToken());
        Uni<VideoData> video = jellyfin.getItem(session.jellyfinUser(), itemId).flatMap(item -> {
            VideoData data = translator.video(item, context);
            if (!needsMediaSource) {
                return Uni.createFrom().item(data);
            }
            return openPlaySession(session, item, data, context);
        });
        return invalidateOnAuthExpired(session, video);
    }

    @Override
    public Uni<PlaybackOutcome> event(Session session, String itemId, Event event) {
        if (event.event() == null) {
            return Uni.createFrom().failure(new IllegalArgumentException("HereSphere event without a type"));
        }
        long positionMillis = Math.max(0L, Math.round(event.time()));
        if (positionMillis > Ticks.MAX_MILLIS) {
            return Uni.createFrom().failure(new IllegalArgumentException(
                    "HereSphere event position out of range: " + event.time() + " ms"));
        }
        long positionTicks = Ticks.fromMillis(positionMillis);
        Instant reportedAt = reportedAt(event);
        Uni<PlaybackOutcome> outcome = playback.state(session.sessionId(), itemId)
                .flatMap(state -> kindOf(session, itemId, event, positionTicks).flatMap(kind -> playback.report(
                        new PlaybackReport(
                                session.sessionId(),
                                itemId,
                                positionTicks,
                                kind,
                                reportedAt,
                                event.event() != EventType.PLAY,
                                state.map(PlaybackState::playSessionId).orElse(null)))));
        return invalidateOnAuthExpired(session, outcome);
    }

    /**
     * Events are ordered by the player's own clock so that a retried or delayed
     * request cannot overtake one sent after it. Players that omit {@code utc}
     * fall back to the arrival time.
     */
    private Instant reportedAt(Event event) {
        if (event.utc() > 0) {
            return Instant.ofEpochMilli((long) event.utc());
        }
        return clock.instant();
    }

    private Uni<VideoData> openPlaySession(
            Session session, JellyfinItem item, VideoData data, TranslationContext context) {
        return jellyfin.playbackInfo(session.jellyfinUser(), item.id()).flatMap(info -> {
            VideoData playable = data.withMedia(List.of(translator.playbackMedia(item.id(), info, context)))
                    .withEventServer(context.eventServer(session.sessionId(), item.id()));
            PlaybackReport start = new PlaybackReport(
                    session.sessionId(),
                    item.id(),
                    item.userData().playbackPositionTicks(),
                    PlaybackEventKind.START,
                    clock.instant(),
                    true,
                    info.playSessionId());
            LOG.debugf("Opened play session %s for item %s", info.playSessionId(), item.id());
            return playback.report(start).replaceWith(playable);
        });
    }

    private Uni<PlaybackEventKind> kindOf(Session session, String itemId, Event event, long positionTicks) {
        return switch (event.event()) {
            case OPEN -> Uni.createFrom().item(PlaybackEventKind.START);
            case PLAY, PAUSE -> Uni.createFrom().item(PlaybackEventKind.PROGRESS);
            case CLOSE -> closeKind(session, itemId, positionTicks);
        };
    }

    /**
     * Close events within the watched threshold of the end mark the item watched.
     */
    private Uni<PlaybackEventKind> closeKind(Session session, String itemId, long positionTicks) {
        long thresholdTicks = Ticks.fromMillis(config.watchedThreshold().toMillis());
        return jellyfin.getItem(session.jellyfinUser(), itemId)
                .map(item -> item.runTimeTicks() != null
                                && item.runTimeTicks() > 0
                                && positionTicks >= item.runTimeTicks() - thresholdTicks
                        ? PlaybackEventKind.WATCHED
                        : PlaybackEventKind.STOP)
                .onFailure(error -> !(error instanceof AuthExpiredException))
                .recoverWithItem(error -> {
                    LOG.warnf("Could not look up item %s on close, recording a stop: %s", itemId, error.getMessage());
                    return PlaybackEventKind.STOP;
                });
    }

    private Uni<TranslatedLibrary> library(Session session, String gatewayUrl) {
        LibraryKey key = new LibraryKey(session.jellyfinUserId(), gatewayUrl);
        Optional<TranslatedLibrary> cached = libraries.get(key);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        TranslationContext context = new TranslationContext(gatewayUrl, session.jellyfinAccessToken());
        Uni<TranslatedLibrary> fresh = jellyfin.listLibrary(session.jellyfinUser())
                .collect()
                .asList()
                .map(items -> {
                    TranslatedLibrary library = translator.library(items, context);
                    long virtual = items.stream().filter(JellyfinItem::isVirtual).count();
                    int dropped = (int) (items.size() - virtual - library.size());
                    metrics.recordLibraryTranslated(library.size(), dropped);
                    LOG.debugf("Translated %d of %d items for user %s", library.size(), items.size(),
                            session.jellyfinUserId());
                    return library;
                })
                .invoke(library -> libraries.put(key, library));
        return invalidateOnAuthExpired(session, fresh);
    }

    private <T> Uni<T> invalidateOnAuthExpired(Session session, Uni<T> operation) {
        return operation.onFailure(AuthExpiredException.class).call(() -> {
            libraries.invalidateIf(key -> key.userId().equals(session.jellyfinUserId()));
            return sessions.invalidateSession(session.sessionId());
        });
    }

    /**
     * Cache key of a translated library. Links embed the gateway URL, so the
     * same user reaching the gateway through two hosts gets two entries.
     */
    record LibraryKey(String userId, String gatewayUrl) {}
}
