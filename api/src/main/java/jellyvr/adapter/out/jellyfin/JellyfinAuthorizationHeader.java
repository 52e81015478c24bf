package jellyvr.adapter.out.jellyfin;

/**
 * Builds the {@code X-Emby-Authorization} header Jellyfin uses to identify
 * client, device and (optionally) the caller's token.
 */
final class JellyfinAuthorizationHeader {

    static final String NAME = "X-Emby-Authorization";
    static final String CLIENT = "jellyvr";

    private JellyfinAuthorizationHeader() {}

    static String of(String deviceName, String deviceId, String clientVersion, String token) {
        final var header = new StringBuilder("MediaBrowser ")
                .append("Client=\"").append(CLIENT).append("\", ")
                .append("Device=\"").append(quote(deviceName)).append("\", ")
                .append("DeviceId=\"").append(quote(deviceId)).append("\", ")
                .append("Version=\"").append(quote(clientVersion)).append('"');
        if (token != null && !token.isBlank()) {
            header.append(", Token=\"").append(quote(token)).append('"');
        }
        return header.toString();
    }

    private static String quote(String value) {
        return value == null ? "" : value.replace("\"", "");
    }
}
