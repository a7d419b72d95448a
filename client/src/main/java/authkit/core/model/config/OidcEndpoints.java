package authkit.core.model.config;

import java.util.Optional;

/**
 * Optional endpoint overrides. Anything left null is resolved through OIDC discovery.
 */
public record OidcEndpoints(
        String authorization,
        String deviceAuthorization,
        String token,
        String introspection,
        String revocation,
        String userinfo,
        String jwks) {

    public static OidcEndpoints none() {
        return new OidcEndpoints(null, null, null, null, null, null, null);
    }

    public Optional<String> authorizationEndpoint() {
        return Optional.ofNullable(authorization);
    }

    public Optional<String> deviceAuthorizationEndpoint() {
        return Optional.ofNullable(deviceAuthorization);
    }

    public Optional<String> tokenEndpoint() {
        return Optional.ofNullable(token);
    }

    public Optional<String> introspectionEndpoint() {
        return Optional.ofNullable(introspection);
    }

    public Optional<String> revocationEndpoint() {
        return Optional.ofNullable(revocation);
    }

    public Optional<String> userinfoEndpoint() {
        return Optional.ofNullable(userinfo);
    }

    public Optional<String> jwksEndpoint() {
        return Optional.ofNullable(jwks);
    }
}
