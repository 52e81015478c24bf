package jellyvr.core.model.jellyfin;

/**
 * Result of starting QuickConnect on Jellyfin.
 *
 * @param secret polling secret
 * @param code code the user enters in an authenticated Jellyfin client
 */
public record QuickConnectInitiation(String secret, String code) {}
