package authkit.core.exception;

/**
 * Malformed or missing auth client configuration.
 *
 * <p>Configuration problems are fatal and never retried.
 */
public class ConfigException extends AuthException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
