package authkit.core.service.request;

import java.time.Clock;
import java.util.Objects;

import org.jboss.logging.Logger;

import authkit.core.model.auth.LoginRequest;
import authkit.core.model.credential.OidcCredential;
import authkit.core.service.client.Loginable;
import authkit.core.service.client.Refreshable;

/**
 * Refreshing authenticator for non-interactive flows. When the credential holds no
 * refresh token, a fresh login is performed instead, so it may start out empty.
 */
public class RefreshOrReloginOidcTokenRequestAuthenticator extends RefreshingOidcTokenRequestAuthenticator {

    private static final Logger LOG = Logger.getLogger(RefreshOrReloginOidcTokenRequestAuthenticator.class);

    private final Loginable<? extends OidcCredential> loginer;

    public RefreshOrReloginOidcTokenRequestAuthenticator(
            OidcCredential credential,
            Refreshable refresher,
            Loginable<? extends OidcCredential> loginer,
            Clock clock) {
        super(credential, refresher, clock);
        this.loginer = Objects.requireNonNull(loginer, "loginer");
    }

    @Override
    protected void refreshCredential() {
        if (oidcCredential().isLoaded() && oidcCredential().refreshToken().isPresent()) {
            super.refreshCredential();
            return;
        }
        LOG.debugf("No refresh token available, logging in again");
        rotate(loginer.login(LoginRequest.defaults()));
    }
}
