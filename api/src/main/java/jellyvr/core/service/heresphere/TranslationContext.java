package jellyvr.core.service.heresphere;

/**
 * Per-request inputs of a translation.
 *
 * @param gatewayUrl scheme and host the player used to reach the gateway
 * @param accessToken Jellyfin token embedded in media URLs, since the player
 *                    cannot send headers when fetching media
 */
public record TranslationContext(String gatewayUrl, String accessToken) {

    public String videoLink(String itemId) {
        return gatewayUrl + "/heresphere/" + itemId;
    }

    public String eventServer(String sessionId, String itemId) {
        return gatewayUrl + "/heresphere/events/" + sessionId + "/" + itemId;
    }

    @Override
    public String toString() {
        return "TranslationContext[gatewayUrl=" + gatewayUrl + "]";
    }
}
