package authkit.core.service.oidc;

import java.util.Map;

import org.jboss.logging.Logger;

import authkit.core.config.AuthKitConfig;
import authkit.core.port.out.HttpTransport;

/**
 * Fetches {@code /.well-known/openid-configuration} once and caches it.
 */
public class DiscoveryApiClient extends OidcApiClient {

    private static final Logger LOG = Logger.getLogger(DiscoveryApiClient.class);
    static final String WELL_KNOWN_PATH = "/.well-known/openid-configuration";

    private Map<String, Object> discovery;

    public DiscoveryApiClient(HttpTransport transport, String authServer, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, discoveryUri(authServer), httpConfig);
    }

    private static String discoveryUri(String authServer) {
        if (authServer == null || authServer.isBlank()) {
            throw new IllegalArgumentException("authServer cannot be null or blank");
        }
        final var base = authServer.endsWith("/") ? authServer.substring(0, authServer.length() - 1) : authServer;
        return base + WELL_KNOWN_PATH;
    }

    /**
     * The discovery document, fetched on first use.
     */
    public Map<String, Object> discovery() {
        if (discovery == null) {
            LOG.debugf("Fetching OIDC discovery document from %s", endpointUri());
            discovery = Map.copyOf(checkedGetJson(null, null));
        }
        return discovery;
    }
}
