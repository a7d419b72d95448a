package authkit.core.model.auth;

import java.util.Optional;

/**
 * Parameters delivered to the redirect URI at the end of an authorization request.
 *
 * @param code             the authorization code, absent on error
 * @param state            the echoed state value
 * @param error            OAuth2 error code, absent on success
 * @param errorDescription human readable error description
 */
public record AuthorizationCallback(String code, String state, String error, String errorDescription) {

    public static AuthorizationCallback success(String code, String state) {
        return new AuthorizationCallback(code, state, null, null);
    }

    public boolean isError() {
        return error != null && !error.isBlank();
    }

    public Optional<String> codeValue() {
        return Optional.ofNullable(code).filter(c -> !c.isBlank());
    }
}
