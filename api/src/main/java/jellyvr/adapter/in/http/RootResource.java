package jellyvr.adapter.in.http;

import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.core.model.common.QuickConnectExpiredException;
import jellyvr.core.model.common.StoreUnavailableException;
import jellyvr.core.model.common.UpstreamRejectedException;
import jellyvr.core.model.common.UpstreamUnavailableException;
import jellyvr.core.model.session.LoginStatus;
import jellyvr.core.port.in.LoginManagement;
import jellyvr.core.port.in.SessionManagement;

/**
 * Browser login: shows the QuickConnect code, then the HereSphere credentials.
 *
 * <p>All login progress lives in the store, so a closed tab or a reload
 * simply picks up where the last poll left off.
 */
@Path("/")
public class RootResource {

    private static final Logger LOG = Logger.getLogger(RootResource.class);

    private final LoginManagement loginManagement;
    private final SessionManagement sessionManagement;
    private final LoginCookies cookies;

    @Inject
    public RootResource(LoginManagement loginManagement, SessionManagement sessionManagement, LoginCookies cookies) {
        this.loginManagement = loginManagement;
        this.sessionManagement = sessionManagement;
        this.cookies = cookies;
    }

    /**
     * Login page. Starts a QuickConnect request when the browser has none,
     * polls it when it has one.
     *
     * @param restart abandon the current login or session and get a new code
     */
    @GET
    @Produces(MediaType.TEXT_HTML)
    public Uni<Response> root(
            @QueryParam("restart") boolean restart, @Context HttpHeaders headers, @Context UriInfo uriInfo) {
        final var loginSecret = cookies.loginSecret(headers.getCookies());
        final var sessionId = cookies.sessionId(headers.getCookies());
        final var gatewayUrl = ForwardedHost.gatewayUrl(headers, uriInfo);

        final Uni<Response> page;
        if (restart) {
            page = startLogin(loginSecret);
        } else if (loginSecret.isPresent()) {
            page = resumeLogin(loginSecret.get(), sessionId, gatewayUrl);
        } else {
            page = showSession(sessionId, gatewayUrl);
        }
        return page.onFailure(RootResource::isOutage).recoverWithItem(error -> {
            LOG.warnv("Login page degraded: {0}", error.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .type(MediaType.TEXT_HTML_TYPE)
                    .entity(DashboardPage.unavailable())
                    .build();
        });
    }

    /**
     * The same state as the login page, as JSON. Read-only apart from the
     * poll itself; the password stays revealable until the page was shown.
     */
    @GET
    @Path("/login/status")
    @Produces(MediaType.APPLICATION_JSON)
    public Uni<LoginStatus> status(@Context HttpHeaders headers) {
        final var loginSecret = cookies.loginSecret(headers.getCookies());
        if (loginSecret.isEmpty()) {
            return Uni.createFrom().item(LoginStatus.unknown());
        }
        return loginManagement.pollLogin(loginSecret.get()).map(status -> {
            if (status.state() == LoginStatus.State.EXPIRED) {
                throw new QuickConnectExpiredException(status.displayCode());
            }
            return status;
        });
    }

    private Uni<Response> resumeLogin(String secret, Optional<String> sessionId, String gatewayUrl) {
        return loginManagement.pollLogin(secret).flatMap(status -> switch (status.state()) {
            case PENDING -> Uni.createFrom().item(html(DashboardPage.pending(status.displayCode())));
            case APPROVED -> loginManagement.completeLogin(secret).map(ignored -> {
                final var identity = status.identity();
                LOG.infof("Showing credentials for %s", identity.username());
                return html(
                        DashboardPage.dashboard(identity.username(), identity.password(), gatewayUrl),
                        cookies.session(identity.sessionId()),
                        cookies.clearLogin());
            });
            case EXPIRED -> Uni.createFrom().item(html(DashboardPage.expired(), cookies.clearLogin()));
            case UNKNOWN -> showSession(sessionId, gatewayUrl);
        });
    }

    private Uni<Response> showSession(Optional<String> sessionId, String gatewayUrl) {
        if (sessionId.isEmpty()) {
            return startLogin(Optional.empty());
        }
        return sessionManagement.findSession(sessionId.get()).flatMap(session -> session.isPresent()
                ? Uni.createFrom()
                        .item(html(
                                DashboardPage.dashboard(session.get().localUsername(), null, gatewayUrl),
                                cookies.clearLogin()))
                : startLogin(Optional.empty()));
    }

    private Uni<Response> startLogin(Optional<String> previousSecret) {
        return loginManagement
                .startLogin(previousSecret)
                .map(request -> html(DashboardPage.pending(request.displayCode()), cookies.login(request.secret())));
    }

    private static Response html(String body, NewCookie... newCookies) {
        return Response.ok(body, MediaType.TEXT_HTML_TYPE).cookie(newCookies).build();
    }

    private static boolean isOutage(Throwable error) {
        return error instanceof StoreUnavailableException
                || error instanceof UpstreamUnavailableException
                || error instanceof UpstreamRejectedException;
    }
}
