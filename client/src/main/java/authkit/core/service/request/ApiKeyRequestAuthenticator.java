package authkit.core.service.request;

import authkit.core.exception.DataIntegrityException;
import authkit.core.model.credential.ApiKeyCredential;
import authkit.core.model.credential.Credential;

/**
 * Sends a static API key, loaded from the credential file on first use.
 */
public class ApiKeyRequestAuthenticator extends CredentialRequestAuthenticator {

    public ApiKeyRequestAuthenticator(ApiKeyCredential credential) {
        super(credential);
    }

    @Override
    public void preRequestHook() {
        if (tokenBody != null) {
            return;
        }
        credential.lazyLoad();
        if (!credential.isLoaded()) {
            throw new DataIntegrityException("No API key credential data", credential.path(), null);
        }
        final var apiKeyCredential = (ApiKeyCredential) credential;
        tokenPrefix = apiKeyCredential.bearerTokenPrefix();
        tokenBody = apiKeyCredential.apiKey();
    }

    @Override
    public void updateCredential(Credential newCredential) {
        if (!(newCredential instanceof ApiKeyCredential)) {
            throw new IllegalArgumentException("ApiKeyRequestAuthenticator requires an ApiKeyCredential");
        }
        super.updateCredential(newCredential);
    }
}
