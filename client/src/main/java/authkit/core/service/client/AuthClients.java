package authkit.core.service.client;

import authkit.core.AuthContext;
import authkit.core.model.config.AuthClientConfig;
import authkit.core.model.config.NoOpClientConfig;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.model.config.PlanetLegacyClientConfig;
import authkit.core.model.config.StaticApiKeyClientConfig;

/**
 * Creates the auth client matching a config variant.
 */
public final class AuthClients {

    private AuthClients() {}

    public static AuthClient create(AuthClientConfig config, AuthContext context) {
        if (config instanceof OidcClientConfig oidc) {
            return createOidc(oidc, context);
        }
        if (config instanceof PlanetLegacyClientConfig legacy) {
            return new PlanetLegacyAuthClient(legacy, context);
        }
        if (config instanceof StaticApiKeyClientConfig staticKey) {
            return new StaticApiKeyAuthClient(staticKey, context);
        }
        if (config instanceof NoOpClientConfig noOp) {
            return new NoOpAuthClient(noOp, context);
        }
        throw new IllegalArgumentException("Unsupported auth client config: " + config);
    }

    /**
     * Create an OIDC client for the config's grant flow.
     */
    public static OidcAuthClient createOidc(OidcClientConfig config, AuthContext context) {
        return switch (config.grantFlow()) {
            case AUTHORIZATION_CODE -> new AuthCodeAuthClient(config, context);
            case DEVICE_CODE -> new DeviceCodeAuthClient(config, context);
            case CLIENT_CREDENTIALS -> new ClientCredentialsAuthClient(config, context);
            case RESOURCE_OWNER_PASSWORD -> new ResourceOwnerAuthClient(config, context);
            case VALIDATION_ONLY -> new ClientValidatorAuthClient(config, context);
        };
    }
}
