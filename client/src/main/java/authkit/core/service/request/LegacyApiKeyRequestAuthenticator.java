package authkit.core.service.request;

import authkit.core.exception.DataIntegrityException;
import authkit.core.model.credential.Credential;
import authkit.core.model.credential.LegacyApiKeyCredential;

/**
 * Sends a legacy API key with the {@code api-key} prefix. The key does not expire,
 * so it is loaded once.
 */
public class LegacyApiKeyRequestAuthenticator extends CredentialRequestAuthenticator {

    public static final String TOKEN_PREFIX = "api-key";

    public LegacyApiKeyRequestAuthenticator(LegacyApiKeyCredential credential) {
        super(credential, TOKEN_PREFIX, DEFAULT_AUTH_HEADER);
    }

    @Override
    public void preRequestHook() {
        if (tokenBody != null) {
            return;
        }
        credential.lazyLoad();
        if (!credential.isLoaded()) {
            throw new DataIntegrityException("No legacy API key credential data", credential.path(), null);
        }
        tokenBody = ((LegacyApiKeyCredential) credential).legacyApiKey();
    }

    @Override
    public void updateCredential(Credential newCredential) {
        if (!(newCredential instanceof LegacyApiKeyCredential)) {
            throw new IllegalArgumentException(
                    "LegacyApiKeyRequestAuthenticator requires a LegacyApiKeyCredential");
        }
        super.updateCredential(newCredential);
    }
}
