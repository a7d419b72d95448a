package authkit.core.service.auth;

import java.net.URI;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;

import authkit.core.config.AuthKitConfig;
import authkit.core.exception.AuthException;
import authkit.core.port.out.HttpTransport;
import authkit.core.port.out.JwksCache;
import authkit.core.service.oidc.JwksApiClient;

/**
 * Service for caching and retrieving JSON Web Key Sets (JWKS).
 *
 * <p>Features:
 * <ul>
 *   <li>In-memory caching with configurable TTL and size bound</li>
 *   <li>One forced refetch when a key ID is not found, to follow key rotation</li>
 *   <li>Falls back to the previously fetched key set if a refetch fails</li>
 * </ul>
 */
public class JwksCacheService implements JwksCache {

    private static final Logger LOG = Logger.getLogger(JwksCacheService.class);

    private final HttpTransport transport;
    private final AuthKitConfig.HttpConfig httpConfig;
    private final Cache<URI, JsonWebKeySet> cache;

    public JwksCacheService(HttpTransport transport, AuthKitConfig config) {
        this.transport = transport;
        this.httpConfig = config.http();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.jwks().maxCacheEntries())
                .expireAfterWrite(config.jwks().cacheTtl())
                .build();
    }

    @Override
    public JsonWebKeySet getKeySet(URI jwksUri) {
        final var cached = cache.getIfPresent(jwksUri);
        if (cached != null) {
            LOG.debugv("Using cached JWKS for {0}", jwksUri);
            return cached;
        }
        return fetchAndCache(jwksUri, null);
    }

    @Override
    public Optional<JsonWebKey> getKey(URI jwksUri, String keyId) {
        final var found = findKey(getKeySet(jwksUri), keyId);
        if (found.isPresent()) {
            return found;
        }
        LOG.infov("Key {0} not found, refreshing JWKS for {1}", keyId, jwksUri);
        return findKey(refresh(jwksUri), keyId);
    }

    @Override
    public JsonWebKeySet refresh(URI jwksUri) {
        LOG.infov("Force refreshing JWKS for {0}", jwksUri);
        final var stale = cache.getIfPresent(jwksUri);
        cache.invalidate(jwksUri);
        return fetchAndCache(jwksUri, stale);
    }

    @Override
    public void invalidate(URI jwksUri) {
        LOG.infov("Invalidating cached JWKS for {0}", jwksUri);
        cache.invalidate(jwksUri);
    }

    private JsonWebKeySet fetchAndCache(URI jwksUri, JsonWebKeySet stale) {
        LOG.infov("Fetching JWKS from {0}", jwksUri);
        try {
            final var keySet = new JwksApiClient(transport, jwksUri.toString(), httpConfig).fetchKeySet();
            cache.put(jwksUri, keySet);
            LOG.infov("Cached {0} keys from {1}", keySet.getJsonWebKeys().size(), jwksUri);
            return keySet;
        } catch (AuthException e) {
            if (stale != null) {
                LOG.warnv("Using stale cached JWKS for {0} due to: {1}", jwksUri, e.getMessage());
                cache.put(jwksUri, stale);
                return stale;
            }
            LOG.errorv(e, "Failed to fetch JWKS from {0}", jwksUri);
            throw e;
        }
    }

    private Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        if (keyId == null) {
            // Without a key ID, accept only an unambiguous single key
            final var keys = keySet.getJsonWebKeys();
            if (keys.size() == 1) {
                return Optional.of(keys.get(0));
            }
            return Optional.empty();
        }

        return keySet.getJsonWebKeys().stream()
                .filter(key -> keyId.equals(key.getKeyId()))
                .findFirst();
    }
}
