package authkit.core.exception;

/**
 * Terminal failure while polling for a device code login.
 */
public class DeviceCodeException extends AuthException {

    public enum Reason {
        ACCESS_DENIED,
        EXPIRED,
        SERVER_ERROR
    }

    private final Reason reason;

    public DeviceCodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DeviceCodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
