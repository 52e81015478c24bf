package jellyvr.adapter.in.http;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;

/**
 * Base URL of the gateway as the client sees it.
 *
 * <p>Behind a reverse proxy the scheme comes from {@code X-Forwarded-Proto}
 * and the authority from {@code Host}; otherwise the request URI is used.
 */
public final class ForwardedHost {

    static final String FORWARDED_PROTO = "X-Forwarded-Proto";

    private ForwardedHost() {}

    public static String gatewayUrl(HttpHeaders headers, UriInfo uriInfo) {
        final var base = uriInfo.getBaseUri();
        final var forwardedProto = firstValue(headers.getHeaderString(FORWARDED_PROTO));
        final var scheme = forwardedProto != null ? forwardedProto : base.getScheme();
        final var hostHeader = firstValue(headers.getHeaderString(HttpHeaders.HOST));
        final var host = hostHeader != null ? hostHeader : base.getRawAuthority();
        return scheme + "://" + host;
    }

    private static String firstValue(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        final var comma = header.indexOf(',');
        final var value = (comma >= 0 ? header.substring(0, comma) : header).trim();
        return value.isEmpty() ? null : value;
    }
}
