package authkit.core.model.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import authkit.core.exception.ConfigException;

/**
 * Configuration for the legacy username/password to API key exchange.
 *
 * @param legacyAuthEndpoint URL accepting {@code {"email", "password"}} JSON logins
 * @param apiKey             optional pre-provisioned API key
 */
public record PlanetLegacyClientConfig(String legacyAuthEndpoint, String apiKey) implements AuthClientConfig {

    public PlanetLegacyClientConfig {
        if (legacyAuthEndpoint == null || legacyAuthEndpoint.isBlank()) {
            throw new ConfigException("legacy_auth_endpoint must be configured for legacy auth client");
        }
    }

    public Optional<String> configuredApiKey() {
        return Optional.ofNullable(apiKey).filter(k -> !k.isBlank());
    }

    @Override
    public ClientType clientType() {
        return ClientType.PLANET_LEGACY;
    }

    @Override
    public Map<String, Object> toMap() {
        final var map = new LinkedHashMap<String, Object>();
        map.put(AuthClientConfigs.CLIENT_TYPE, clientType().wireName());
        map.put("legacy_auth_endpoint", legacyAuthEndpoint);
        if (apiKey != null) {
            map.put("api_key", apiKey);
        }
        return map;
    }
}
