package authkit.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates PKCE verifiers and challenges plus the {@code state} and
 * {@code nonce} values of an authorization request.
 *
 * <p>Implements the client side of RFC 7636. Only the S256 challenge method is
 * used as the plain method provides insufficient security.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636</a>
 */
public class PkceService {

    private static final int VERIFIER_LENGTH = 64;
    private static final int STATE_LENGTH = 32;
    private static final int NONCE_LENGTH = 32;

    private final SecureRandom secureRandom;

    public PkceService() {
        this(new SecureRandom());
    }

    public PkceService(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Generate a cryptographically secure code verifier.
     *
     * <p>Per RFC 7636, the verifier must be between 43-128 characters,
     * using unreserved characters (A-Z, a-z, 0-9, "-", ".", "_", "~").
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateCodeVerifier() {
        return randomUrlSafe(VERIFIER_LENGTH);
    }

    /**
     * Generate S256 challenge from verifier.
     *
     * <p>Computes: BASE64URL(SHA256(verifier))
     *
     * @param verifier The code verifier
     * @return Base64URL encoded SHA-256 hash of the verifier
     */
    public String generateChallenge(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Generate a cryptographically secure state parameter.
     *
     * @return URL-safe base64 encoded random string
     */
    public String generateState() {
        return randomUrlSafe(STATE_LENGTH);
    }

    /**
     * Generate a nonce to bind the ID token to this authorization request.
     */
    public String generateNonce() {
        return randomUrlSafe(NONCE_LENGTH);
    }

    private String randomUrlSafe(int length) {
        final var bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
