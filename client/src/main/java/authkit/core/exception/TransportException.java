package authkit.core.exception;

/**
 * HTTP or network failure talking to an authorization server.
 */
public class TransportException extends AuthException {

    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed exchange, or 0 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
