package jellyvr.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import jellyvr.core.config.QuickConnectConfig;

/**
 * Random material for new sessions: session ids, local passwords and salts.
 *
 * <p>Session ids are 256 random bits in URL-safe Base64; they double as the
 * HereSphere auth token and appear in event server URLs. Passwords are short
 * runs of lowercase letters because they are typed on a VR keyboard.
 */
@ApplicationScoped
public class CredentialGenerator {

    private static final int SESSION_ID_BYTES = 32;
    private static final int SALT_BYTES = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder SESSION_ID_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final int passwordLength;

    @Inject
    public CredentialGenerator(QuickConnectConfig config) {
        this(config.passwordLength());
    }

    public CredentialGenerator(int passwordLength) {
        if (passwordLength < 4) {
            throw new IllegalArgumentException("Password length must be at least 4, got " + passwordLength);
        }
        this.passwordLength = passwordLength;
    }

    /**
     * @return a URL-safe session id of 43 characters
     */
    public String sessionId() {
        return SESSION_ID_ENCODER.encodeToString(randomBytes(SESSION_ID_BYTES));
    }

    public String password() {
        StringBuilder password = new StringBuilder(passwordLength);
        for (int i = 0; i < passwordLength; i++) {
            password.append((char) ('a' + SECURE_RANDOM.nextInt(26)));
        }
        return password.toString();
    }

    public String salt() {
        return HexFormat.of().formatHex(randomBytes(SALT_BYTES));
    }

    private static byte[] randomBytes(int count) {
        byte[] bytes = new byte[count];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }
}
