package jellyvr.adapter.out.jellyfin;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import jellyvr.core.config.JellyfinConfig;
import jellyvr.core.model.common.AuthExpiredException;
import jellyvr.core.model.common.UpstreamRejectedException;
import jellyvr.core.model.common.UpstreamUnavailableException;
import jellyvr.core.model.jellyfin.JellyfinItem;
import jellyvr.core.model.jellyfin.JellyfinUser;
import jellyvr.core.model.jellyfin.PlaybackInfo;
import jellyvr.core.model.jellyfin.ProgressReport;
import jellyvr.core.model.jellyfin.QuickConnectInitiation;
import jellyvr.core.model.jellyfin.QuickConnectStatus;
import jellyvr.core.model.playback.PlaybackEventKind;
import jellyvr.core.port.out.JellyfinUpstream;

/**
 * Jellyfin REST client built on the Vert.x web client.
 *
 * <p>Every request carries the {@code X-Emby-Authorization} header and the
 * configured request timeout. Status codes map onto the gateway's upstream
 * exceptions; nothing here retries.
 */
@ApplicationScoped
public class JellyfinHttpClient implements JellyfinUpstream {

    private static final Logger LOG = Logger.getLogger(JellyfinHttpClient.class);

    static final String GATEWAY_DEVICE_ID = "jellyvr-gateway";
    static final String ITEM_FIELDS =
            "DateCreated,MediaSources,BasicSyncInfo,Genres,Tags,Studios,SeriesStudio,People,Chapters";
    private static final String APP_STORE_URL = "https://github.com/alyti/jellyvr/";

    private final WebClient webClient;
    private final JellyfinConfig config;
    private final String baseUrl;

    @Inject
    public JellyfinHttpClient(Vertx vertx, JellyfinConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.baseUrl = stripTrailingSlash(config.baseUrl());
    }

    @Override
    public Uni<QuickConnectInitiation> quickConnectInitiate() {
        final var request = request(webClient.postAbs(baseUrl + "/QuickConnect/Initiate"), GATEWAY_DEVICE_ID, null);
        return execute(request.send(), "quickConnectInitiate").map(response -> {
            if (response.statusCode() == 401) {
                throw new UpstreamRejectedException("QuickConnect is disabled on the Jellyfin server", 401);
            }
            expectSuccess(response, "quickConnectInitiate");
            final var json = body(response);
            final var secret = JellyfinJsonMapper.string(json, "Secret");
            final var code = JellyfinJsonMapper.string(json, "Code");
            if (secret == null || code == null) {
                throw new UpstreamRejectedException("QuickConnect initiation without secret or code", 200);
            }
            return new QuickConnectInitiation(secret, code);
        });
    }

    @Override
    public Uni<QuickConnectStatus> quickConnectPoll(String secret, String deviceId) {
        final var request = request(webClient.getAbs(baseUrl + "/QuickConnect/Connect"), deviceId, null)
                .addQueryParam("Secret", secret);
        return execute(request.send(), "quickConnectPoll").flatMap(response -> {
            if (response.statusCode() == 400 || response.statusCode() == 404) {
                LOG.debugf("QuickConnect secret no longer known upstream (status %d)", response.statusCode());
                return Uni.createFrom().item(QuickConnectStatus.REJECTED);
            }
            expectSuccess(response, "quickConnectPoll");
            if (!Boolean.TRUE.equals(JellyfinJsonMapper.bool(body(response), "Authenticated"))) {
                return Uni.createFrom().item(QuickConnectStatus.PENDING);
            }
            return authenticateWithQuickConnect(secret, deviceId);
        });
    }

    private Uni<QuickConnectStatus> authenticateWithQuickConnect(String secret, String deviceId) {
        final var request = request(webClient.postAbs(baseUrl + "/Users/AuthenticateWithQuickConnect"), deviceId, null);
        return execute(request.sendJsonObject(new JsonObject().put("Secret", secret)), "authenticateWithQuickConnect")
                .map(response -> {
                    expectSuccess(response, "authenticateWithQuickConnect");
                    final var json = body(response);
                    final var user = json.getValue("User") instanceof JsonObject value ? value : new JsonObject();
                    final var userId = JellyfinJsonMapper.string(user, "Id");
                    final var token = JellyfinJsonMapper.string(json, "AccessToken");
                    if (userId == null || token == null) {
                        throw new UpstreamRejectedException("QuickConnect authentication without user or token", 200);
                    }
                    return QuickConnectStatus.approved(userId, JellyfinJsonMapper.string(user, "Name"), token);
                });
    }

    @Override
    public Multi<JellyfinItem> listLibrary(JellyfinUser user) {
        return Multi.createBy()
                .repeating()
                .uni(AtomicInteger::new, start -> fetchPage(user, start.get())
                        .invoke(page -> start.set(page.nextStart())))
                .whilst(Page::hasMore)
                .onItem()
                .transformToIterable(Page::items);
    }

    private Uni<Page> fetchPage(JellyfinUser user, int startIndex) {
        final var request = request(webClient.getAbs(baseUrl + "/Users/" + segment(user.userId()) + "/Items"), user)
                .addQueryParam("SortBy", "SortName,ProductionYear")
                .addQueryParam("SortOrder", "Ascending")
                .addQueryParam("IncludeItemTypes", "Movie,Episode")
                .addQueryParam("Recursive", "true")
                .addQueryParam("Fields", ITEM_FIELDS)
                .addQueryParam("ImageTypeLimit", "1")
                .addQueryParam("EnableImageTypes", "Primary,Backdrop")
                .addQueryParam("IsMissing", "false")
                .addQueryParam("StartIndex", String.valueOf(startIndex))
                .addQueryParam("Limit", String.valueOf(config.pageSize()));
        return execute(request.send(), "listLibrary").map(response -> {
            expectSuccess(response, "listLibrary");
            final var json = body(response);
            final var length = JellyfinJsonMapper.pageLength(json);
            LOG.debugf("Fetched library page at %d: %d entries", startIndex, length);
            return new Page(
                    JellyfinJsonMapper.items(json), startIndex + length, length, JellyfinJsonMapper.total(json));
        });
    }

    @Override
    public Uni<JellyfinItem> getItem(JellyfinUser user, String itemId) {
        final var url = baseUrl + "/Users/" + segment(user.userId()) + "/Items/" + segment(itemId);
        return execute(request(webClient.getAbs(url), user).send(), "getItem").map(response -> {
            expectSuccess(response, "getItem");
            return JellyfinJsonMapper.item(body(response))
                    .orElseThrow(() -> new UpstreamRejectedException("Item without an id: " + itemId, 200));
        });
    }

    @Override
    public Uni<PlaybackInfo> playbackInfo(JellyfinUser user, String itemId) {
        final var request = request(webClient.postAbs(baseUrl + "/Items/" + segment(itemId) + "/PlaybackInfo"), user)
                .addQueryParam("UserId", user.userId());
        final var body = new JsonObject().put("UserId", user.userId());
        return execute(request.sendJsonObject(body), "playbackInfo").map(response -> {
            expectSuccess(response, "playbackInfo");
            final var json = body(response);
            return new PlaybackInfo(
                    JellyfinJsonMapper.string(json, "PlaySessionId"), JellyfinJsonMapper.mediaSources(json));
        });
    }

    @Override
    public Uni<Void> reportProgress(JellyfinUser user, ProgressReport report) {
        final var body = new JsonObject()
                .put("ItemId", report.itemId())
                .put("PositionTicks", report.positionTicks())
                .put("IsPaused", report.paused())
                .put("CanSeek", true);
        if (report.playSessionId() != null) {
            body.put("PlaySessionId", report.playSessionId());
        }
        final var relayed = postJson(user, progressPath(report.kind()), body, "reportProgress");
        if (report.kind() != PlaybackEventKind.WATCHED) {
            return relayed;
        }
        final var playedUrl = "/Users/" + segment(user.userId()) + "/PlayedItems/" + segment(report.itemId());
        return relayed.flatMap(ignored -> postJson(user, playedUrl, null, "markPlayed"));
    }

    static String progressPath(PlaybackEventKind kind) {
        return switch (kind) {
            case START -> "/Sessions/Playing";
            case PROGRESS -> "/Sessions/Playing/Progress";
            case STOP, WATCHED -> "/Sessions/Playing/Stopped";
        };
    }

    @Override
    public Uni<Void> reportCapabilities(JellyfinUser user) {
        final var body = new JsonObject()
                .put("PlayableMediaTypes", new JsonArray(List.of("Video")))
                .put("SupportedCommands", new JsonArray())
                .put("SupportsMediaControl", false)
                .put("SupportsPersistentIdentifier", false)
                .put("AppStoreUrl", APP_STORE_URL);
        return postJson(user, "/Sessions/Capabilities/Full", body, "reportCapabilities");
    }

    @Override
    public Uni<Void> logout(JellyfinUser user) {
        return postJson(user, "/Sessions/Logout", null, "logout");
    }

    private Uni<Void> postJson(JellyfinUser user, String path, JsonObject body, String operation) {
        final var request = request(webClient.postAbs(baseUrl + path), user);
        final var sent = body == null ? request.send() : request.sendJsonObject(body);
        return execute(sent, operation).map(response -> {
            expectSuccess(response, operation);
            return null;
        });
    }

    private HttpRequest<Buffer> request(HttpRequest<Buffer> request, JellyfinUser user) {
        return request(request, user.deviceId(), user.accessToken());
    }

    private HttpRequest<Buffer> request(HttpRequest<Buffer> request, String deviceId, String token) {
        final var header = JellyfinAuthorizationHeader.of(
                config.deviceName(), deviceId, config.clientVersion(), token);
        return request.timeout(config.requestTimeout().toMillis())
                .putHeader(JellyfinAuthorizationHeader.NAME, header)
                .putHeader("Accept", "application/json");
    }

    /**
     * Turns transport failures (connect errors, timeouts) into {@link UpstreamUnavailableException}.
     */
    private Uni<HttpResponse<Buffer>> execute(Uni<HttpResponse<Buffer>> sent, String operation) {
        return sent.onFailure().transform(error -> {
            LOG.debugf(error, "Jellyfin %s failed in transport", operation);
            return new UpstreamUnavailableException("Jellyfin " + operation + " failed: " + error.getMessage(), error);
        });
    }

    static void expectSuccess(HttpResponse<Buffer> response, String operation) {
        final var status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        if (status == 401) {
            throw new AuthExpiredException("Jellyfin rejected the access token during " + operation);
        }
        if (status >= 500) {
            throw new UpstreamUnavailableException("Jellyfin " + operation + " returned " + status, status);
        }
        LOG.warnf("Jellyfin %s returned unexpected status %d", operation, status);
        throw new UpstreamRejectedException("Jellyfin " + operation + " returned " + status, status);
    }

    private static JsonObject body(HttpResponse<Buffer> response) {
        try {
            final var json = response.bodyAsJsonObject();
            return json == null ? new JsonObject() : json;
        } catch (RuntimeException e) {
            throw new UpstreamRejectedException("Jellyfin returned a non-object body", response.statusCode());
        }
    }

    private static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record Page(List<JellyfinItem> items, int nextStart, int length, long total) {

        boolean hasMore() {
            return length > 0 && nextStart < total;
        }
    }
}
