package authkit.core.exception;

/**
 * Terminal failure of an interactive authorization code login.
 */
public class AuthorizationCodeException extends AuthException {

    public enum Reason {
        USER_CANCELLED,
        STATE_MISMATCH,
        NONCE_MISMATCH,
        TIMEOUT,
        SERVER_ERROR,
        NO_INTERACTION_ALLOWED
    }

    private final Reason reason;

    public AuthorizationCodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthorizationCodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
