package authkit.core.service.request;

import java.time.Clock;
import java.util.Objects;

import org.jboss.logging.Logger;

import authkit.core.exception.AuthException;
import authkit.core.exception.TokenValidationException;
import authkit.core.model.auth.UnverifiedJwt;
import authkit.core.model.credential.Credential;
import authkit.core.model.credential.OidcCredential;
import authkit.core.service.client.Refreshable;

/**
 * Bearer token authenticator that refreshes the access token as it nears expiry.
 *
 * <p>Past three quarters of the token's lifetime the credential is first reloaded
 * from its file, since another process sharing it may already have refreshed. Only
 * if the token is still stale is the refresh token used. New tokens are saved
 * back to the same file before they are used.
 *
 * <p>A failed reload or refresh is logged and the current token is sent anyway.
 * The server decides whether it is still acceptable.
 */
public class RefreshingOidcTokenRequestAuthenticator extends CredentialRequestAuthenticator {

    private static final Logger LOG = Logger.getLogger(RefreshingOidcTokenRequestAuthenticator.class);

    private final Refreshable refresher;
    private final Clock clock;
    private long refreshAt;

    /**
     * @param credential the credential to use; may hold no data yet if it has a path to load from
     * @param refresher  client used to refresh tokens, or null to only reload from disk
     * @param clock      time source
     */
    public RefreshingOidcTokenRequestAuthenticator(OidcCredential credential, Refreshable refresher, Clock clock) {
        super(Objects.requireNonNull(credential, "credential"));
        this.refresher = refresher;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void preRequestHook() {
        if (tokenBody != null && now() <= refreshAt) {
            return;
        }

        if (now() > refreshAt) {
            try {
                credential.load();
            } catch (RuntimeException e) {
                LOG.warnv(e, "Failed to reload credential from {0}", credential.path());
            }
            recompute();
        }

        if (now() > refreshAt) {
            try {
                refreshCredential();
            } catch (RuntimeException e) {
                LOG.warnv(e, "Failed to refresh credential, continuing with the current token");
            }
        }
    }

    /**
     * Obtain new tokens and swap them in.
     *
     * @throws AuthException if no refresh is possible
     */
    protected void refreshCredential() {
        if (refresher == null) {
            throw new AuthException("No auth client available to refresh the credential");
        }
        final var refreshToken = oidcCredential()
                .refreshToken()
                .orElseThrow(() -> new AuthException("Credential has no refresh token"));
        LOG.debugf("Refreshing access token for credential at %s", credential.path());
        rotate(refresher.refresh(refreshToken));
    }

    /**
     * Persist a new credential to the current credential's file and start using it.
     */
    protected void rotate(OidcCredential newCredential) {
        newCredential.setPath(credential.path());
        newCredential.save();
        credential = newCredential;
        credential.load();
        recompute();
    }

    private void recompute() {
        final var accessToken = oidcCredential().accessToken().filter(t -> !t.isBlank());
        if (accessToken.isEmpty()) {
            tokenBody = null;
            refreshAt = 0;
            return;
        }
        tokenBody = accessToken.get();
        try {
            refreshAt = UnverifiedJwt.decode(tokenBody).refreshAt();
        } catch (TokenValidationException e) {
            LOG.warnv("Access token is not a JWT ({0}), using stored expiry", e.getMessage());
            refreshAt = storedRefreshAt();
        }
    }

    private long storedRefreshAt() {
        final var iat = credential.issuedAt();
        final var exp = credential.expiresAt();
        if (iat.isEmpty() || exp.isEmpty()) {
            return 0;
        }
        return iat.get() + (3 * (exp.get() - iat.get())) / 4;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    protected OidcCredential oidcCredential() {
        return (OidcCredential) credential;
    }

    /**
     * Epoch second after which the current token is considered stale.
     */
    public long refreshAt() {
        return refreshAt;
    }

    @Override
    public void updateCredential(Credential newCredential) {
        if (!(newCredential instanceof OidcCredential)) {
            throw new IllegalArgumentException(getClass().getSimpleName()
                    + " requires an OidcCredential, got "
                    + (newCredential == null ? "null" : newCredential.getClass().getSimpleName()));
        }
        super.updateCredential(newCredential);
        refreshAt = 0;
    }
}
