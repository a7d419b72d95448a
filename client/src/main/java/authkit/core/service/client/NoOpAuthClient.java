package authkit.core.service.client;

import java.nio.file.Path;

import authkit.core.AuthContext;
import authkit.core.model.config.NoOpClientConfig;
import authkit.core.model.credential.Credential;
import authkit.core.service.request.CredentialRequestAuthenticator;
import authkit.core.service.request.SimpleInMemoryRequestAuthenticator;

/**
 * A client for services that need no authentication. Requests go out without an
 * authorization header.
 */
public final class NoOpAuthClient implements AuthClient {

    private final NoOpClientConfig config;
    private final AuthContext context;

    public NoOpAuthClient(NoOpClientConfig config, AuthContext context) {
        this.config = config;
        this.context = context;
    }

    @Override
    public NoOpClientConfig config() {
        return config;
    }

    @Override
    public Credential credentialForFile(Path path) {
        return new Credential(null, path, context.documentStore(), context.clock());
    }

    @Override
    public CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential) {
        return new SimpleInMemoryRequestAuthenticator(credential);
    }
}
