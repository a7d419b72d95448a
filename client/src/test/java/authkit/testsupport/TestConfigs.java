package authkit.testsupport;

import java.util.HashMap;
import java.util.Map;

import authkit.core.model.config.AuthClientConfigs;
import authkit.core.model.config.OidcClientConfig;

/**
 * OIDC client configs pointing at {@link TestTokens#ISSUER} with every endpoint set.
 */
public final class TestConfigs {

    public static final String AUTH_SERVER = TestTokens.ISSUER;
    public static final String TOKEN_URL = AUTH_SERVER + "/oauth/token";
    public static final String AUTHORIZE_URL = AUTH_SERVER + "/oauth/authorize";
    public static final String DEVICE_URL = AUTH_SERVER + "/oauth/device";
    public static final String INTROSPECT_URL = AUTH_SERVER + "/oauth/introspect";
    public static final String REVOKE_URL = AUTH_SERVER + "/oauth/revoke";
    public static final String USERINFO_URL = AUTH_SERVER + "/userinfo";
    public static final String JWKS_URL = AUTH_SERVER + "/jwks";
    public static final String DISCOVERY_URL = AUTH_SERVER + "/.well-known/openid-configuration";

    private TestConfigs() {}

    public static Map<String, Object> oidcMap(String clientType) {
        final var map = new HashMap<String, Object>();
        map.put("client_type", clientType);
        map.put("auth_server", AUTH_SERVER);
        map.put("client_id", "client-1");
        map.put("issuer", TestTokens.ISSUER);
        map.put("audiences", TestTokens.AUDIENCE);
        map.put("token_endpoint", TOKEN_URL);
        map.put("authorization_endpoint", AUTHORIZE_URL);
        map.put("device_authorization_endpoint", DEVICE_URL);
        map.put("introspection_endpoint", INTROSPECT_URL);
        map.put("revocation_endpoint", REVOKE_URL);
        map.put("userinfo_endpoint", USERINFO_URL);
        map.put("jwks_endpoint", JWKS_URL);
        return map;
    }

    public static OidcClientConfig oidc(String clientType) {
        return oidc(oidcMap(clientType));
    }

    public static OidcClientConfig oidc(Map<String, Object> map) {
        return (OidcClientConfig) AuthClientConfigs.fromMap(map);
    }

    public static String tokenResponse(String accessToken, String refreshToken) {
        final var refresh = refreshToken == null ? "" : ",\"refresh_token\":\"" + refreshToken + "\"";
        return "{\"access_token\":\"" + accessToken + "\",\"token_type\":\"Bearer\",\"expires_in\":3600" + refresh
                + "}";
    }
}
