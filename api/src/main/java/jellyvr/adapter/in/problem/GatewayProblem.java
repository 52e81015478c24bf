package jellyvr.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for gateway errors.
 *
 * <p>Details are fixed strings; upstream messages and store paths stay in
 * the logs.
 */
public final class GatewayProblem {

    static final long RETRY_AFTER_SECONDS = 5L;

    private GatewayProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem notFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem loginRequired(String detail) {
        return HttpProblem.builder()
                .withTitle("Login Required")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem loginExpired(String displayCode) {
        return HttpProblem.builder()
                .withTitle("Login Expired")
                .withStatus(Status.GONE)
                .withDetail("QuickConnect code %s expired, start a new login".formatted(displayCode))
                .with("restart", "/?restart=true")
                .build();
    }

    public static HttpProblem badGateway(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem unavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .with("retryAfter", RETRY_AFTER_SECONDS)
                .build();
    }
}
