package authkit.core.service.client;

import authkit.core.AuthContext;
import authkit.core.exception.AuthException;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.model.credential.Credential;
import authkit.core.model.credential.OidcCredential;
import authkit.core.service.request.CredentialRequestAuthenticator;
import authkit.core.service.request.RefreshOrReloginOidcTokenRequestAuthenticator;
import authkit.spi.LoginPrompter.UsernamePassword;

/**
 * Resource owner password grant. Only for legacy integrations that cannot use another flow.
 *
 * <p>Credentials come from the login request, then the client config, then a prompt
 * if prompting is allowed.
 */
public final class ResourceOwnerAuthClient extends OidcAuthClient implements Loginable<OidcCredential> {

    public ResourceOwnerAuthClient(OidcClientConfig config, AuthContext context) {
        super(config, context);
    }

    @Override
    public OidcCredential login(LoginRequest request) {
        final var owner = resolveOwner(request);
        return credentialFrom(tokenClient()
                .getTokenFromPassword(
                        config.clientId(),
                        owner.username(),
                        owner.password(),
                        scopesOrDefault(request.requestedScopes()),
                        audiencesOrDefault(request.requestedAudiences()),
                        extraWithDefaults(request.extra()),
                        enricher));
    }

    private UsernamePassword resolveOwner(LoginRequest request) {
        final var username = request.username() != null ? request.username() : config.username();
        final var password = request.password() != null ? request.password() : config.password();
        if (!isBlank(username) && !isBlank(password)) {
            return new UsernamePassword(username, password);
        }
        if (request.allowTtyPrompt()) {
            return context.loginPrompter()
                    .promptForUsernamePassword()
                    .orElseThrow(() -> new AuthException("Login cancelled, no username and password entered"));
        }
        throw new AuthException("A username and password are required for resource owner login");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential) {
        final var oidcCredential = credential == null ? credentialForFile(null) : requireOidcCredential(credential);
        return new RefreshOrReloginOidcTokenRequestAuthenticator(oidcCredential, this, this, context.clock());
    }
}
