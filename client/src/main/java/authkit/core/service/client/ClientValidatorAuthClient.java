package authkit.core.service.client;

import authkit.core.AuthContext;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.model.credential.Credential;
import authkit.core.service.request.CredentialRequestAuthenticator;
import authkit.core.service.request.SimpleInMemoryRequestAuthenticator;

/**
 * A client that only validates tokens presented to it, for resource servers.
 * It cannot log in and does not authenticate outgoing requests.
 */
public final class ClientValidatorAuthClient extends OidcAuthClient {

    public ClientValidatorAuthClient(OidcClientConfig config, AuthContext context) {
        super(config, context);
    }

    @Override
    public CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential) {
        return new SimpleInMemoryRequestAuthenticator(credential);
    }
}
