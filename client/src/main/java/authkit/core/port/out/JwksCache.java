package authkit.core.port.out;

import java.net.URI;
import java.util.Optional;

import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;

/**
 * Port for the signing keys of authorization servers, keyed by JWKS endpoint.
 *
 * <p>Lookups block on the calling thread. A key set fetched once is served from
 * memory until its TTL passes; a lookup for an unknown key ID triggers one refetch
 * so that rotated keys are picked up without waiting for expiry.
 */
public interface JwksCache {

    /**
     * The key set published at an endpoint, from cache when still fresh.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the key set
     * @throws authkit.core.exception.TransportException if the endpoint cannot be reached
     * @throws authkit.core.exception.ProtocolException  if the response is not a usable key set
     */
    JsonWebKeySet getKeySet(URI jwksUri);

    /**
     * Get a specific key by ID, refetching the key set once if the ID is not cached.
     *
     * @param jwksUri the JWKS endpoint URI
     * @param keyId   the key ID (kid) to retrieve, or null to accept a lone key
     * @return the key if found
     */
    Optional<JsonWebKey> getKey(URI jwksUri, String keyId);

    /**
     * Fetch the key set again, replacing the cached copy. Falls back to the stale
     * copy if the fetch fails and one is held.
     */
    JsonWebKeySet refresh(URI jwksUri);

    void invalidate(URI jwksUri);
}
