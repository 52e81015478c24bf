package jellyvr.core.service.heresphere;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import jellyvr.core.config.JellyfinConfig;

/**
 * Rewrites Jellyfin URLs onto the host the VR client can reach.
 *
 * <p>Server-relative paths are prefixed with the external base URL. Absolute
 * URLs on the internal base URL get their prefix swapped. Anything else is
 * returned unchanged. Pure and safe to call from any thread.
 */
@ApplicationScoped
public class MediaUrlRewriter {

    private final String internalBaseUrl;
    private final String externalBaseUrl;

    @Inject
    public MediaUrlRewriter(JellyfinConfig config) {
        this(config.baseUrl(), config.mediaBaseUrl());
    }

    public MediaUrlRewriter(String internalBaseUrl, String externalBaseUrl) {
        this.internalBaseUrl = trimTrailingSlash(internalBaseUrl);
        this.externalBaseUrl = trimTrailingSlash(externalBaseUrl);
    }

    public String rewrite(String url) {
        if (url == null || url.isEmpty()) {
            return url;
        }
        if (url.startsWith("/")) {
            return externalBaseUrl + url;
        }
        if (url.equals(internalBaseUrl)
                || url.startsWith(internalBaseUrl + "/")
                || url.startsWith(internalBaseUrl + "?")) {
            return externalBaseUrl + url.substring(internalBaseUrl.length());
        }
        return url;
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
