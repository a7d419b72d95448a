package authkit.core.service.oidc;

import java.util.LinkedHashMap;
import java.util.Map;

import authkit.core.config.AuthKitConfig;
import authkit.core.exception.TokenValidationException;
import authkit.core.port.out.HttpTransport;

/**
 * Client for the token introspection endpoint (RFC 7662).
 *
 * <p>A response without {@code "active": true} fails with kind INACTIVE_TOKEN.
 */
public class IntrospectionApiClient extends OidcApiClient {

    public IntrospectionApiClient(
            HttpTransport transport, String introspectionUri, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, introspectionUri, httpConfig);
    }

    public Map<String, Object> validateAccessToken(String accessToken, ClientAuthEnricher enricher) {
        return validateToken(accessToken, "access_token", enricher);
    }

    public Map<String, Object> validateIdToken(String idToken, ClientAuthEnricher enricher) {
        return validateToken(idToken, "id_token", enricher);
    }

    public Map<String, Object> validateRefreshToken(String refreshToken, ClientAuthEnricher enricher) {
        return validateToken(refreshToken, "refresh_token", enricher);
    }

    private Map<String, Object> validateToken(String token, String tokenTypeHint, ClientAuthEnricher enricher) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(
                    TokenValidationException.Kind.MALFORMED_ARGUMENT, "Cannot introspect an empty token");
        }
        final var form = new LinkedHashMap<String, String>();
        form.put("token", token);
        form.put("token_type_hint", tokenTypeHint);
        final var response = enrichedPostFormJson(form, enricher);
        if (!Boolean.TRUE.equals(response.get("active"))) {
            throw new TokenValidationException(
                    TokenValidationException.Kind.INACTIVE_TOKEN,
                    "Token is not active according to " + endpointUri());
        }
        return response;
    }
}
