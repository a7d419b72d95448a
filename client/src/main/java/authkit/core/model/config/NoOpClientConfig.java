package authkit.core.model.config;

import java.util.Map;

/**
 * Configuration for a client that performs no authentication at all.
 */
public record NoOpClientConfig() implements AuthClientConfig {

    @Override
    public ClientType clientType() {
        return ClientType.NONE;
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of(AuthClientConfigs.CLIENT_TYPE, ClientType.NONE.wireName());
    }
}
