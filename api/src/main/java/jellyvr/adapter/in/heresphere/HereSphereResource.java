package jellyvr.adapter.in.heresphere;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.adapter.in.http.ForwardedHost;
import jellyvr.core.model.common.AuthExpiredException;
import jellyvr.core.model.heresphere.Event;
import jellyvr.core.model.heresphere.Index;
import jellyvr.core.model.heresphere.Request;
import jellyvr.core.model.session.Session;
import jellyvr.core.port.in.HereSphereGateway;
import jellyvr.core.port.in.SessionManagement;
import jellyvr.core.util.LogFormat;

/**
 * HereSphere web API.
 *
 * <p>Callers identify either with the {@code auth-token} header obtained from
 * {@code /heresphere/auth} or with username and password in the body. Anyone
 * else, and anyone whose Jellyfin token expired, gets {@code access: -1}.
 */
@Path("/heresphere")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class HereSphereResource {

    private static final Logger LOG = Logger.getLogger(HereSphereResource.class);
    static final String AUTH_TOKEN_HEADER = "auth-token";

    private final HereSphereGateway gateway;
    private final SessionManagement sessions;

    @Inject
    public HereSphereResource(HereSphereGateway gateway, SessionManagement sessions) {
        this.gateway = gateway;
        this.sessions = sessions;
    }

    @POST
    @Path("/auth")
    public Uni<AuthResponse> auth(Request request) {
        return gateway.resolveSession(Optional.empty(), request)
                .map(session -> session.map(s -> AuthResponse.granted(s.sessionId()))
                        .orElseGet(AuthResponse::denied));
    }

    @POST
    public Uni<Response> index(
            Request request,
            @HeaderParam(AUTH_TOKEN_HEADER) String authToken,
            @Context HttpHeaders headers,
            @Context UriInfo uriInfo) {
        final var gatewayUrl = ForwardedHost.gatewayUrl(headers, uriInfo);
        return authorized(authToken, request, session -> gateway.index(session, gatewayUrl));
    }

    @POST
    @Path("/scan")
    public Uni<Response> scan(
            Request request,
            @HeaderParam(AUTH_TOKEN_HEADER) String authToken,
            @Context HttpHeaders headers,
            @Context UriInfo uriInfo) {
        final var gatewayUrl = ForwardedHost.gatewayUrl(headers, uriInfo);
        return authorized(authToken, request, session -> gateway.scan(session, gatewayUrl));
    }

    @POST
    @Path("/{itemId}")
    public Uni<Response> video(
            @PathParam("itemId") String itemId,
            Request request,
            @HeaderParam(AUTH_TOKEN_HEADER) String authToken,
            @Context HttpHeaders headers,
            @Context UriInfo uriInfo) {
        final var gatewayUrl = ForwardedHost.gatewayUrl(headers, uriInfo);
        final var needsMediaSource = request != null && request.wantsMediaSource();
        return authorized(
                authToken, request, session -> gateway.video(session, gatewayUrl, itemId, needsMediaSource));
    }

    /**
     * Playback callback. The session is part of the URL handed out as
     * {@code eventServer}, so no credentials are sent here.
     */
    @POST
    @Path("/events/{sessionId}/{itemId}")
    public Uni<Response> event(
            @PathParam("sessionId") String sessionId, @PathParam("itemId") String itemId, Event event) {
        if (event == null) {
            return Uni.createFrom().item(Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "missing event"))
                    .build());
        }
        return sessions.findSession(sessionId).flatMap(session -> {
            if (session.isEmpty()) {
                LOG.debugf("Event for unknown session %s", LogFormat.abbreviate(sessionId));
                return Uni.createFrom().item(denied());
            }
            return gateway.event(session.get(), itemId, event)
                    .map(outcome -> Response.ok(Map.of("disposition", outcome.disposition()))
                            .build());
        }).onFailure(AuthExpiredException.class).recoverWithItem(HereSphereResource::denied);
    }

    private <T> Uni<Response> authorized(String authToken, Request request, Function<Session, Uni<T>> action) {
        return gateway.resolveSession(Optional.ofNullable(authToken), request)
                .flatMap(session -> session.isEmpty()
                        ? Uni.createFrom().item(denied())
                        : action.apply(session.get()).map(body -> Response.ok(body).build()))
                .onFailure(AuthExpiredException.class)
                .recoverWithItem(error -> {
                    LOG.infov("Jellyfin token expired, asking HereSphere to log in again: {0}", error.getMessage());
                    return denied();
                });
    }

    private static Response denied() {
        return Response.ok(Index.denied()).build();
    }
}
