package authkit.core.service.oidc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import authkit.core.config.AuthKitConfig;
import authkit.core.port.out.HttpTransport;

/**
 * Client for the token endpoint. One method per grant type; all calls carry client authentication.
 */
public class TokenApiClient extends OidcApiClient {

    public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    public static final String GRANT_REFRESH_TOKEN = "refresh_token";
    public static final String GRANT_CLIENT_CREDENTIALS = "client_credentials";
    public static final String GRANT_PASSWORD = "password";
    public static final String GRANT_DEVICE_CODE = "urn:ietf:params:oauth:grant-type:device_code";

    public TokenApiClient(HttpTransport transport, String tokenUri, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, tokenUri, httpConfig);
    }

    public Map<String, Object> getTokenFromCode(
            String redirectUri, String clientId, String code, String codeVerifier, ClientAuthEnricher enricher) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", GRANT_AUTHORIZATION_CODE);
        form.put("client_id", clientId);
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        form.put("code_verifier", codeVerifier);
        return enrichedPostFormJson(form, enricher);
    }

    public Map<String, Object> getTokenFromRefresh(
            String clientId,
            String refreshToken,
            List<String> requestedScopes,
            Map<String, String> extra,
            ClientAuthEnricher enricher) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", GRANT_REFRESH_TOKEN);
        form.put("client_id", clientId);
        form.put("refresh_token", refreshToken);
        putScopes(form, requestedScopes);
        putExtra(form, extra);
        return enrichedPostFormJson(form, enricher);
    }

    public Map<String, Object> getTokenFromClientCredentials(
            String clientId,
            List<String> requestedScopes,
            List<String> requestedAudiences,
            Map<String, String> extra,
            ClientAuthEnricher enricher) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", GRANT_CLIENT_CREDENTIALS);
        form.put("client_id", clientId);
        putScopes(form, requestedScopes);
        putAudiences(form, requestedAudiences);
        putExtra(form, extra);
        return enrichedPostFormJson(form, enricher);
    }

    public Map<String, Object> getTokenFromPassword(
            String clientId,
            String username,
            String password,
            List<String> requestedScopes,
            List<String> requestedAudiences,
            Map<String, String> extra,
            ClientAuthEnricher enricher) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", GRANT_PASSWORD);
        form.put("client_id", clientId);
        form.put("username", username);
        form.put("password", password);
        putScopes(form, requestedScopes);
        putAudiences(form, requestedAudiences);
        putExtra(form, extra);
        return enrichedPostFormJson(form, enricher);
    }

    /**
     * One poll of the token endpoint for a pending device authorization.
     *
     * @throws authkit.core.exception.ProtocolException carrying {@code authorization_pending},
     *                                                  {@code slow_down} or a terminal error code
     */
    public Map<String, Object> getTokenFromDeviceCode(
            String clientId, String deviceCode, ClientAuthEnricher enricher) {
        final var form = new LinkedHashMap<String, String>();
        form.put("grant_type", GRANT_DEVICE_CODE);
        form.put("client_id", clientId);
        form.put("device_code", deviceCode);
        return enrichedPostFormJson(form, enricher);
    }

    static void putScopes(Map<String, String> form, List<String> scopes) {
        if (scopes != null && !scopes.isEmpty()) {
            form.put("scope", String.join(" ", scopes));
        }
    }

    static void putAudiences(Map<String, String> form, List<String> audiences) {
        if (audiences != null && !audiences.isEmpty()) {
            form.put("audience", String.join(" ", audiences));
        }
    }

    static void putExtra(Map<String, String> form, Map<String, String> extra) {
        if (extra != null) {
            extra.forEach(form::putIfAbsent);
        }
    }
}
