package authkit.core.service.request;

import org.jboss.logging.Logger;

import authkit.core.model.credential.Credential;

/**
 * Authenticator with a fixed, possibly empty, token. Knows nothing about credential
 * types and ignores credential updates. Used by clients that never authenticate
 * requests, and for stubbing.
 */
public class SimpleInMemoryRequestAuthenticator extends CredentialRequestAuthenticator {

    private static final Logger LOG = Logger.getLogger(SimpleInMemoryRequestAuthenticator.class);

    public SimpleInMemoryRequestAuthenticator(Credential credential) {
        super(credential);
    }

    public SimpleInMemoryRequestAuthenticator(String tokenBody, String tokenPrefix, String authHeader) {
        super(null, tokenPrefix, authHeader);
        this.tokenBody = tokenBody;
    }

    @Override
    public void preRequestHook() {
        // token is fixed
    }

    @Override
    public void updateCredential(Credential newCredential) {
        LOG.warn("SimpleInMemoryRequestAuthenticator ignores credential updates");
    }
}
