package authkit.core.service.oidc;

import java.util.LinkedHashMap;

import authkit.core.config.AuthKitConfig;
import authkit.core.port.out.HttpTransport;

/**
 * Client for the token revocation endpoint (RFC 7009). An empty 200 response is success.
 */
public class RevocationApiClient extends OidcApiClient {

    public RevocationApiClient(HttpTransport transport, String revocationUri, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, revocationUri, httpConfig);
    }

    public void revokeAccessToken(String accessToken, ClientAuthEnricher enricher) {
        revokeToken(accessToken, "access_token", enricher);
    }

    public void revokeRefreshToken(String refreshToken, ClientAuthEnricher enricher) {
        revokeToken(refreshToken, "refresh_token", enricher);
    }

    private void revokeToken(String token, String tokenTypeHint, ClientAuthEnricher enricher) {
        final var form = new LinkedHashMap<String, String>();
        form.put("token", token);
        form.put("token_type_hint", tokenTypeHint);
        final var enriched = enricher.enrich(form, endpointUri());
        checkedPostForm(enriched.form(), enriched.headers());
    }
}
