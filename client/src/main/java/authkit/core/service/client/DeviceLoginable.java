package authkit.core.service.client;

import authkit.core.model.auth.DeviceAuthorization;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.credential.OidcCredential;

/**
 * An auth client whose login can be split into initiation and completion, so the
 * application controls how the user code is presented.
 */
public interface DeviceLoginable {

    /**
     * Request a device code. The returned authorization must be shown to the user.
     */
    DeviceAuthorization deviceLoginInitiate(LoginRequest request);

    /**
     * Poll until the user approves or denies the authorization, or it expires.
     *
     * @throws authkit.core.exception.DeviceCodeException on denial or expiry
     */
    OidcCredential deviceLoginComplete(DeviceAuthorization authorization);
}
