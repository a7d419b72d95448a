package authkit.core.service.request;

import authkit.core.exception.AuthException;
import authkit.core.model.credential.Credential;

/**
 * Authenticator that refuses to authenticate anything. Signals a configuration or
 * programming error if it is ever reached.
 */
public class ForbiddenRequestAuthenticator extends CredentialRequestAuthenticator {

    public ForbiddenRequestAuthenticator(Credential credential) {
        super(credential);
    }

    @Override
    public void preRequestHook() {
        throw new AuthException("Making authenticated requests with the ForbiddenRequestAuthenticator is forbidden."
                + " This is most likely the result of a configuration or programming error.");
    }
}
