package jellyvr.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import jellyvr.core.model.common.AuthExpiredException;
import jellyvr.core.model.common.QuickConnectExpiredException;
import jellyvr.core.model.common.StoreUnavailableException;
import jellyvr.core.model.common.UpstreamRejectedException;
import jellyvr.core.model.common.UpstreamUnavailableException;

/**
 * Global exception mappers for converting domain exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapStoreUnavailable(StoreUnavailableException e) {
        LOG.errorv(e, "Store {0} failed", e.getOperation());
        return toResponse(GatewayProblem.unavailable("Storage is temporarily unavailable"));
    }

    @ServerExceptionMapper
    public Response mapUpstreamUnavailable(UpstreamUnavailableException e) {
        LOG.warnv("Jellyfin unavailable: {0}", e.getMessage());
        return toResponse(GatewayProblem.unavailable("Jellyfin is temporarily unavailable"));
    }

    @ServerExceptionMapper
    public Response mapUpstreamRejected(UpstreamRejectedException e) {
        if (e.getStatusCode() == 404) {
            LOG.debugv("Jellyfin has no such resource: {0}", e.getMessage());
            return toResponse(GatewayProblem.notFound("No such item"));
        }
        LOG.warnv("Jellyfin rejected a request: {0}", e.getMessage());
        return toResponse(GatewayProblem.badGateway("Jellyfin rejected the request"));
    }

    @ServerExceptionMapper
    public Response mapAuthExpired(AuthExpiredException e) {
        LOG.debugv("Jellyfin token expired: {0}", e.getMessage());
        return toResponse(GatewayProblem.loginRequired("Jellyfin login expired, log in again"));
    }

    @ServerExceptionMapper
    public Response mapQuickConnectExpired(QuickConnectExpiredException e) {
        return toResponse(GatewayProblem.loginExpired(e.getDisplayCode()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(GatewayProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
