package authkit.core.service.oidc;

import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import authkit.core.config.AuthKitConfig;
import authkit.core.exception.ProtocolException;
import authkit.core.port.out.HttpTransport;
import authkit.core.util.JsonMaps;

/**
 * Fetches a JSON Web Key Set. Caching is left to {@link authkit.core.port.out.JwksCache}.
 */
public class JwksApiClient extends OidcApiClient {

    private static final Logger LOG = Logger.getLogger(JwksApiClient.class);

    public JwksApiClient(HttpTransport transport, String jwksUri, AuthKitConfig.HttpConfig httpConfig) {
        super(transport, jwksUri, httpConfig);
    }

    public JsonWebKeySet fetchKeySet() {
        final var json = checkedGetJson(null, null);
        if (!json.containsKey("keys")) {
            throw new ProtocolException(
                    endpointUri(), 200, "JWKS response from " + endpointUri() + " has no 'keys' member", null);
        }
        try {
            final var keySet = new JsonWebKeySet(JsonMaps.toJson(json));
            LOG.debugf("Fetched %d keys from %s", keySet.getJsonWebKeys().size(), endpointUri());
            return keySet;
        } catch (JoseException e) {
            throw new ProtocolException(
                    endpointUri(), 200, "Failed to parse JWKS response: " + e.getMessage(), JsonMaps.toJson(json));
        }
    }
}
