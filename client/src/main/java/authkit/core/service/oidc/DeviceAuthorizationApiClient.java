package authkit.core.service.oidc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import authkit.core.config.AuthKitConfig;
import authkit.core.port.out.HttpTransport;

/**
 * Client for the device authorization endpoint (RFC 8628).
 */
public class DeviceAuthorizationApiClient extends OidcApiClient {

    public DeviceAuthorizationApiClient(
            HttpTransport transport, String deviceAuthorizationUri, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, deviceAuthorizationUri, httpConfig);
    }

    /**
     * Request a device code and user code pair.
     *
     * @return the raw endpoint response
     */
    public Map<String, Object> requestDeviceCode(
            String clientId,
            List<String> requestedScopes,
            List<String> requestedAudiences,
            Map<String, String> extra,
            ClientAuthEnricher enricher) {
        final var form = new LinkedHashMap<String, String>();
        form.put("client_id", clientId);
        TokenApiClient.putScopes(form, requestedScopes);
        TokenApiClient.putAudiences(form, requestedAudiences);
        TokenApiClient.putExtra(form, extra);
        return enrichedPostFormJson(form, enricher);
    }
}
