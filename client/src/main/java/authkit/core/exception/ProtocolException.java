package authkit.core.exception;

import java.util.Optional;

/**
 * The authorization server answered with an OAuth2/OIDC error payload.
 *
 * <p>Carries the raw {@code error} (or {@code errorCode}) value so that flows can
 * react to specific codes such as {@code authorization_pending}.
 */
public class ProtocolException extends AuthException {

    private final String endpoint;
    private final int statusCode;
    private final String errorCode;
    private final String errorDescription;
    private final String rawBody;

    public ProtocolException(
            String endpoint, int statusCode, String errorCode, String errorDescription, String rawBody) {
        super(String.format("Error from OIDC endpoint at %s: %s: %s", endpoint, errorCode, errorDescription));
        this.endpoint = endpoint;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.errorDescription = errorDescription;
        this.rawBody = rawBody;
    }

    public ProtocolException(String endpoint, int statusCode, String message, String rawBody) {
        super(message);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
        this.errorCode = null;
        this.errorDescription = null;
        this.rawBody = rawBody;
    }

    public String endpoint() {
        return endpoint;
    }

    public int statusCode() {
        return statusCode;
    }

    public Optional<String> errorCode() {
        return Optional.ofNullable(errorCode);
    }

    public Optional<String> errorDescription() {
        return Optional.ofNullable(errorDescription);
    }

    public String rawBody() {
        return rawBody;
    }

    public boolean hasErrorCode(String code) {
        return code != null && code.equals(errorCode);
    }
}
