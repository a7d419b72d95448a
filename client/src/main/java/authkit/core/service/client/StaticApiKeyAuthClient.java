package authkit.core.service.client;

import java.nio.file.Path;

import authkit.core.AuthContext;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.config.StaticApiKeyClientConfig;
import authkit.core.model.credential.ApiKeyCredential;
import authkit.core.model.credential.Credential;
import authkit.core.service.request.ApiKeyRequestAuthenticator;
import authkit.core.service.request.CredentialRequestAuthenticator;

/**
 * A pre-provisioned API key. Login just materialises the configured key as a credential.
 */
public final class StaticApiKeyAuthClient implements AuthClient, Loginable<ApiKeyCredential> {

    private final StaticApiKeyClientConfig config;
    private final AuthContext context;

    public StaticApiKeyAuthClient(StaticApiKeyClientConfig config, AuthContext context) {
        this.config = config;
        this.context = context;
    }

    @Override
    public StaticApiKeyClientConfig config() {
        return config;
    }

    @Override
    public ApiKeyCredential login(LoginRequest request) {
        return ApiKeyCredential.of(
                config.apiKey(), config.bearerTokenPrefix(), context.documentStore(), context.clock());
    }

    @Override
    public ApiKeyCredential credentialForFile(Path path) {
        return new ApiKeyCredential(null, path, context.documentStore(), context.clock());
    }

    @Override
    public CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential) {
        if (!(credential instanceof ApiKeyCredential)) {
            throw new IllegalArgumentException("Static API key auth client requires an ApiKeyCredential");
        }
        return new ApiKeyRequestAuthenticator((ApiKeyCredential) credential);
    }
}
