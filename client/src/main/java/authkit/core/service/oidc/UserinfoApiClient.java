package authkit.core.service.oidc;

import java.util.Map;

import authkit.core.config.AuthKitConfig;
import authkit.core.port.out.HttpTransport;

/**
 * Client for the OIDC userinfo endpoint.
 */
public class UserinfoApiClient extends OidcApiClient {

    public UserinfoApiClient(HttpTransport transport, String userinfoUri, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, userinfoUri, httpConfig);
    }

    public Map<String, Object> userinfoFromAccessToken(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken cannot be null or blank");
        }
        return checkedGetJson(null, Map.of("Authorization", "Bearer " + accessToken));
    }
}
