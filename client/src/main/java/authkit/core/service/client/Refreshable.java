package authkit.core.service.client;

import java.util.List;
import java.util.Map;

import authkit.core.model.credential.OidcCredential;

/**
 * An auth client that can exchange a refresh token for new tokens.
 *
 * <p>Refresh never adds the configured default scopes. A down-scoped refresh token
 * keeps its reduced scope; callers wanting the full set must log in again.
 */
public interface Refreshable {

    /**
     * Refresh tokens.
     *
     * @param refreshToken    the refresh token
     * @param requestedScopes scopes to request, or empty for the server default
     * @param extra           extra parameters passed to the token endpoint
     * @return a new in-memory credential
     */
    OidcCredential refresh(String refreshToken, List<String> requestedScopes, Map<String, String> extra);

    default OidcCredential refresh(String refreshToken) {
        return refresh(refreshToken, List.of(), Map.of());
    }
}
