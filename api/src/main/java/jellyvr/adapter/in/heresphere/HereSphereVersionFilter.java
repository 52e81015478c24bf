package jellyvr.adapter.in.heresphere;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;

import org.jboss.resteasy.reactive.server.ServerResponseFilter;

/**
 * Stamps every HereSphere response, including mapped errors, with the API
 * version header the player checks for.
 */
public class HereSphereVersionFilter {

    static final String VERSION_HEADER = "HereSphere-JSON-Version";
    static final String VERSION = "1";

    @ServerResponseFilter
    public void addVersionHeader(ContainerRequestContext request, ContainerResponseContext response) {
        final var path = request.getUriInfo().getPath();
        if (path.equals("/heresphere") || path.startsWith("/heresphere/")) {
            response.getHeaders().putSingle(VERSION_HEADER, VERSION);
        }
    }
}
