package authkit.spi;

import java.util.Optional;

import authkit.core.model.auth.DeviceAuthorization;

/**
 * User interaction during login.
 *
 * <p>Applications provide an implementation suited to their environment, such as
 * a terminal prompt or a GUI dialog. The library calls these methods only when the
 * login request allows prompting, except for {@link #presentDeviceCode} which is
 * always called since device login is impossible without it.
 */
public interface LoginPrompter {

    /**
     * Ask the user to complete authorization at the URL and paste back the code.
     *
     * @param authorizationUrl the URL to visit
     * @return the authorization code, or empty if the user cancelled
     */
    Optional<String> promptForAuthorizationCode(String authorizationUrl);

    /**
     * Tell the user to open a URL because no browser could be launched.
     *
     * @param authorizationUrl the URL to visit
     */
    void presentAuthorizationUrl(String authorizationUrl);

    /**
     * Show the user code and verification URL of a device login.
     *
     * @param authorization the pending device authorization
     */
    void presentDeviceCode(DeviceAuthorization authorization);

    /**
     * Ask for resource owner credentials.
     *
     * @return the credentials, or empty if the user cancelled
     */
    Optional<UsernamePassword> promptForUsernamePassword();

    /**
     * Resource owner credentials entered by the user.
     */
    record UsernamePassword(String username, String password) {
        @Override
        public String toString() {
            return "UsernamePassword[username=" + username + "]";
        }
    }
}
