package authkit.core.service.client;

import authkit.core.AuthContext;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.model.credential.Credential;
import authkit.core.model.credential.OidcCredential;
import authkit.core.service.request.CredentialRequestAuthenticator;
import authkit.core.service.request.RefreshOrReloginOidcTokenRequestAuthenticator;

/**
 * Client credentials grant for confidential clients acting on their own behalf.
 */
public final class ClientCredentialsAuthClient extends OidcAuthClient implements Loginable<OidcCredential> {

    public ClientCredentialsAuthClient(OidcClientConfig config, AuthContext context) {
        super(config, context);
    }

    @Override
    public OidcCredential login(LoginRequest request) {
        return credentialFrom(tokenClient()
                .getTokenFromClientCredentials(
                        config.clientId(),
                        scopesOrDefault(request.requestedScopes()),
                        audiencesOrDefault(request.requestedAudiences()),
                        extraWithDefaults(request.extra()),
                        enricher));
    }

    /**
     * Logs in again whenever no refresh token is held, which needs no user interaction
     * for this flow. A null credential starts the authenticator with no tokens.
     */
    @Override
    public CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential) {
        final var oidcCredential = credential == null ? credentialForFile(null) : requireOidcCredential(credential);
        return new RefreshOrReloginOidcTokenRequestAuthenticator(oidcCredential, this, this, context.clock());
    }
}
