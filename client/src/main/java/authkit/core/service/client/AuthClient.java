package authkit.core.service.client;

import java.nio.file.Path;

import authkit.core.model.config.AuthClientConfig;
import authkit.core.model.credential.Credential;
import authkit.core.service.request.CredentialRequestAuthenticator;

/**
 * A configured client of one authentication mechanism.
 *
 * <p>What a client can do beyond building request authenticators is expressed by
 * the capability interfaces it implements: {@link Loginable}, {@link Refreshable}
 * and {@link DeviceLoginable}.
 */
public sealed interface AuthClient
        permits OidcAuthClient, PlanetLegacyAuthClient, StaticApiKeyAuthClient, NoOpAuthClient {

    AuthClientConfig config();

    /**
     * An empty credential of the type this client produces, bound to a file.
     *
     * @param path the credential file, or null for an in-memory credential
     */
    Credential credentialForFile(Path path);

    /**
     * The request authenticator best suited to this client's flow.
     *
     * @param credential the credential to authenticate requests with
     * @throws IllegalArgumentException if the credential is of the wrong type
     */
    CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential);

    /**
     * The default request authenticator for a credential file.
     */
    default CredentialRequestAuthenticator defaultRequestAuthenticatorForFile(Path tokenFile) {
        return defaultRequestAuthenticator(credentialForFile(tokenFile));
    }
}
