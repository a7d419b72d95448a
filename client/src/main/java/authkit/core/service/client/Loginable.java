package authkit.core.service.client;

import authkit.core.model.auth.LoginRequest;
import authkit.core.model.credential.Credential;

/**
 * An auth client that can obtain a new credential by logging in.
 *
 * @param <C> the credential type produced
 */
public interface Loginable<C extends Credential> {

    /**
     * Log in and return a new in-memory credential. The caller decides where to save it.
     *
     * @param request login options; unset values fall back to the client config
     * @return the new credential, without a path
     */
    C login(LoginRequest request);

    default C login() {
        return login(LoginRequest.defaults());
    }
}
