package authkit.core.service.legacy;

import java.util.LinkedHashMap;

import authkit.core.config.AuthKitConfig;
import authkit.core.exception.ProtocolException;
import authkit.core.port.out.HttpTransport;
import authkit.core.service.oidc.OidcApiClient;
import authkit.core.util.JsonMaps;

/**
 * Client for the legacy username/password login endpoint.
 *
 * <p>The endpoint answers a JSON {@code {"email", "password"}} post with
 * {@code {"token": "<jwt>"}}.
 */
public class LegacyAuthApiClient extends OidcApiClient {

    public LegacyAuthApiClient(
            HttpTransport transport, String legacyAuthEndpoint, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, legacyAuthEndpoint, httpConfig);
    }

    /**
     * Log in and return the JWT issued by the legacy endpoint.
     */
    public String login(String email, String password) {
        final var body = new LinkedHashMap<String, Object>();
        body.put("email", email);
        body.put("password", password);
        final var response = checkedPostJsonJson(body, null);
        return JsonMaps.string(response, "token")
                .filter(t -> !t.isBlank())
                .orElseThrow(() -> new ProtocolException(
                        endpointUri(), 200, "Legacy login response from " + endpointUri() + " has no token", null));
    }
}
