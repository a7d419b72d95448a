package authkit.core.model.config;

import java.util.LinkedHashMap;
import java.util.Map;

import authkit.core.exception.ConfigException;

/**
 * Configuration for a static API key presented as a bearer-style header.
 *
 * @param apiKey            the key
 * @param bearerTokenPrefix header value prefix (default: Bearer)
 */
public record StaticApiKeyClientConfig(String apiKey, String bearerTokenPrefix) implements AuthClientConfig {

    public static final String DEFAULT_PREFIX = "Bearer";

    public StaticApiKeyClientConfig {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigException("api_key must be configured for static API key auth client");
        }
        if (bearerTokenPrefix == null) {
            bearerTokenPrefix = DEFAULT_PREFIX;
        }
    }

    @Override
    public ClientType clientType() {
        return ClientType.STATIC_API_KEY;
    }

    @Override
    public Map<String, Object> toMap() {
        final var map = new LinkedHashMap<String, Object>();
        map.put(AuthClientConfigs.CLIENT_TYPE, clientType().wireName());
        map.put("api_key", apiKey);
        map.put("bearer_token_prefix", bearerTokenPrefix);
        return map;
    }

    @Override
    public String toString() {
        return "StaticApiKeyClientConfig[bearerTokenPrefix=" + bearerTokenPrefix + "]";
    }
}
