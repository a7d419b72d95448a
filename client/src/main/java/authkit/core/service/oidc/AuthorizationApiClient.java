package authkit.core.service.oidc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds authorization endpoint URLs for the authorization code flow with PKCE.
 *
 * <p>The authorization endpoint is reached by the user's browser, never by this
 * library, so no transport is involved.
 */
public class AuthorizationApiClient {

    static final String PKCE_METHOD = "S256";

    private final String authorizationUri;

    public AuthorizationApiClient(String authorizationUri) {
        if (authorizationUri == null || authorizationUri.isBlank()) {
            throw new IllegalArgumentException("authorizationUri cannot be null or blank");
        }
        this.authorizationUri = authorizationUri;
    }

    public String endpointUri() {
        return authorizationUri;
    }

    /**
     * Build the URL the user is sent to.
     *
     * @param request the authorization request parameters
     * @return the full authorization URL
     */
    public String authorizationUrl(AuthorizationRequest request) {
        final var params = new LinkedHashMap<String, String>();
        params.put("response_type", "code");
        params.put("client_id", request.clientId());
        params.put("redirect_uri", request.redirectUri());
        params.put("state", request.state());
        params.put("nonce", request.nonce());
        params.put("code_challenge", request.codeChallenge());
        params.put("code_challenge_method", PKCE_METHOD);
        TokenApiClient.putScopes(params, request.scopes());
        TokenApiClient.putAudiences(params, request.audiences());
        TokenApiClient.putExtra(params, request.extra());
        final var separator = authorizationUri.contains("?") ? "&" : "?";
        return authorizationUri + separator + OidcApiClient.formEncode(params);
    }

    /**
     * Parameters of one authorization request.
     */
    public record AuthorizationRequest(
            String clientId,
            String redirectUri,
            String state,
            String nonce,
            String codeChallenge,
            List<String> scopes,
            List<String> audiences,
            Map<String, String> extra) {}
}
