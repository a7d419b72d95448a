package authkit.spi;

import java.util.Optional;

import org.jboss.logging.Logger;

import authkit.core.model.auth.DeviceAuthorization;

/**
 * Prompter for environments without a user at the keyboard.
 *
 * <p>Presentations are written to the log. Prompts are answered with empty, which
 * the flows treat as a cancelled login.
 */
public class HeadlessLoginPrompter implements LoginPrompter {

    private static final Logger LOG = Logger.getLogger(HeadlessLoginPrompter.class);

    @Override
    public Optional<String> promptForAuthorizationCode(String authorizationUrl) {
        LOG.warn("Authorization code requested but no interactive prompter is configured");
        return Optional.empty();
    }

    @Override
    public void presentAuthorizationUrl(String authorizationUrl) {
        LOG.infof("Complete login by visiting %s", authorizationUrl);
    }

    @Override
    public void presentDeviceCode(DeviceAuthorization authorization) {
        LOG.infof(
                "Complete login by visiting %s and entering the code %s",
                authorization.completeUri().orElse(authorization.verificationUri()),
                authorization.userCode());
    }

    @Override
    public Optional<UsernamePassword> promptForUsernamePassword() {
        LOG.warn("Username and password requested but no interactive prompter is configured");
        return Optional.empty();
    }
}
