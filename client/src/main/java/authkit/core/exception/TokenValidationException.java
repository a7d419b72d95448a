package authkit.core.exception;

/**
 * A token failed validation.
 *
 * <p>The {@link Kind} tells callers why, so that "expired" can be told apart from
 * "untrusted" or "malformed" without parsing messages.
 */
public class TokenValidationException extends AuthException {

    /**
     * Machine distinguishable validation failure kinds.
     */
    public enum Kind {
        EXPIRED,
        NOT_YET_VALID,
        UNKNOWN_SIGNING_KEY,
        INVALID_ALGORITHM,
        INVALID_SIGNATURE,
        WRONG_ISSUER,
        WRONG_AUDIENCE,
        MISSING_REQUIRED_SCOPE,
        MALFORMED_ARGUMENT,
        INACTIVE_TOKEN,
        UNTRUSTED_ISSUER
    }

    private final Kind kind;

    public TokenValidationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TokenValidationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
