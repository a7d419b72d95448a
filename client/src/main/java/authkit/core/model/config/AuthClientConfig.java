package authkit.core.model.config;

import java.util.Map;

/**
 * Resolved configuration for one auth client.
 *
 * <p>A closed set of variants. Dispatch happens over the variant type, never over
 * a runtime class name.
 */
public sealed interface AuthClientConfig
        permits OidcClientConfig, PlanetLegacyClientConfig, StaticApiKeyClientConfig, NoOpClientConfig {

    ClientType clientType();

    /**
     * Serializable key/value form, as it would appear in a config file.
     * Null values are omitted.
     */
    Map<String, Object> toMap();
}
