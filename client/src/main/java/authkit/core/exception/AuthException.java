package authkit.core.exception;

/**
 * Root of every failure raised by the authentication toolkit.
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
