package jellyvr.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for deriving identifiers and checking local passwords.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;

    private SecureHash() {}

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1 to 64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is less than 1 or greater than 64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return HexFormat.of().formatHex(sha256(input.getBytes(StandardCharsets.UTF_8))).substring(0, hexChars);
    }

    /**
     * Hash a password with a salt.
     *
     * @param salt     hex encoded salt
     * @param password plaintext password
     * @return hex encoded SHA-256 of salt and password
     */
    public static String saltedSha256(String salt, String password) {
        byte[] saltBytes = HexFormat.of().parseHex(salt);
        byte[] passwordBytes = password.getBytes(StandardCharsets.UTF_8);
        byte[] input = new byte[saltBytes.length + passwordBytes.length];
        System.arraycopy(saltBytes, 0, input, 0, saltBytes.length);
        System.arraycopy(passwordBytes, 0, input, saltBytes.length, passwordBytes.length);
        return HexFormat.of().formatHex(sha256(input));
    }

    /**
     * Check a password against a stored salted hash in constant time.
     *
     * @param expectedHash stored hex hash
     * @param salt         stored hex salt
     * @param candidate    password to check
     * @return true if the candidate hashes to the stored value
     */
    public static boolean matches(String expectedHash, String salt, String candidate) {
        if (expectedHash == null || salt == null || candidate == null) {
            return false;
        }
        byte[] expected = expectedHash.getBytes(StandardCharsets.US_ASCII);
        byte[] actual = saltedSha256(salt, candidate).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("Every JDK ships SHA-256", e);
        }
    }
}
