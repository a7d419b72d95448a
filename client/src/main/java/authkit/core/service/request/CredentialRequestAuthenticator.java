package authkit.core.service.request;

import authkit.core.model.credential.Credential;

/**
 * A request authenticator driven by a {@link Credential}.
 */
public abstract class CredentialRequestAuthenticator extends RequestAuthenticator {

    protected Credential credential;

    protected CredentialRequestAuthenticator(Credential credential, String tokenPrefix, String authHeader) {
        super(null, tokenPrefix, authHeader);
        this.credential = credential;
    }

    protected CredentialRequestAuthenticator(Credential credential) {
        this(credential, DEFAULT_TOKEN_PREFIX, DEFAULT_AUTH_HEADER);
    }

    public Credential credential() {
        return credential;
    }

    /**
     * Swap in a new credential. The token body is cleared and rebuilt on the next request.
     *
     * @param newCredential the new credential
     * @throws IllegalArgumentException if this authenticator does not support the credential type
     */
    public void updateCredential(Credential newCredential) {
        this.credential = newCredential;
        this.tokenBody = null;
    }
}
