package authkit.core.service.client;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;

import org.jboss.logging.Logger;

import authkit.core.AuthContext;
import authkit.core.exception.AuthorizationCodeException;
import authkit.core.exception.AuthorizationCodeException.Reason;
import authkit.core.exception.ConfigException;
import authkit.core.model.auth.AuthorizationCallback;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.auth.UnverifiedJwt;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.model.credential.OidcCredential;
import authkit.core.service.oidc.AuthorizationApiClient.AuthorizationRequest;

/**
 * Authorization code flow with PKCE.
 *
 * <p>When a browser may be opened, a listener on the local redirect URI receives
 * the callback. Otherwise the user visits the authorization URL on their own and
 * pastes back the code, which requires a remote redirect URI in the config.
 */
public final class AuthCodeAuthClient extends OidcAuthClient implements Loginable<OidcCredential> {

    private static final Logger LOG = Logger.getLogger(AuthCodeAuthClient.class);

    public AuthCodeAuthClient(OidcClientConfig config, AuthContext context) {
        super(config, context);
    }

    @Override
    public OidcCredential login(LoginRequest request) {
        if (!request.allowOpenBrowser() && !request.allowTtyPrompt()) {
            throw new AuthorizationCodeException(
                    Reason.NO_INTERACTION_ALLOWED,
                    "Authorization code login requires a browser or a prompt, and neither is allowed");
        }

        final var pkce = context.pkceService();
        final var verifier = pkce.generateCodeVerifier();
        final var state = pkce.generateState();
        final var nonce = pkce.generateNonce();

        final String redirectUri;
        final String code;
        if (request.allowOpenBrowser()) {
            redirectUri = config.localRedirectUri();
            code = codeFromLocalCallback(request, redirectUri, verifier, state, nonce);
        } else {
            redirectUri = config.configuredRemoteRedirectUri()
                    .orElseThrow(() -> new ConfigException("remote_redirect_uri must be configured for "
                            + config.clientType().wireName() + " auth client to log in without a browser"));
            code = codeFromPrompt(request, redirectUri, verifier, state, nonce);
        }

        final var tokens =
                tokenClient().getTokenFromCode(redirectUri, config.clientId(), code, verifier, enricher);
        final var credential = credentialFrom(tokens);
        checkNonce(credential, nonce);
        LOG.debugf("Authorization code login completed for client %s", config.clientId());
        return credential;
    }

    private String codeFromLocalCallback(
            LoginRequest request, String redirectUri, String verifier, String state, String nonce) {
        final AuthorizationCallback callback;
        try (var pending = context.callbackReceiver().listen(URI.create(redirectUri), callbackAcknowledgement())) {
            final var url = authorizationUrl(request, redirectUri, verifier, state, nonce);
            if (!context.browserLauncher().open(URI.create(url))) {
                LOG.debugf("No browser available, presenting authorization URL");
                context.loginPrompter().presentAuthorizationUrl(url);
            }
            callback = pending.await(context.config().authCode().callbackTimeout());
        }

        if (callback.isError()) {
            final var reason = "access_denied".equals(callback.error()) ? Reason.USER_CANCELLED : Reason.SERVER_ERROR;
            throw new AuthorizationCodeException(reason, "Authorization failed: " + callback.error()
                    + (callback.errorDescription() == null ? "" : ": " + callback.errorDescription()));
        }
        if (!state.equals(callback.state())) {
            throw new AuthorizationCodeException(
                    Reason.STATE_MISMATCH, "Callback state does not match the state of the authorization request");
        }
        return callback.codeValue()
                .orElseThrow(() -> new AuthorizationCodeException(
                        Reason.SERVER_ERROR, "Authorization callback did not carry a code"));
    }

    private String codeFromPrompt(
            LoginRequest request, String redirectUri, String verifier, String state, String nonce) {
        final var url = authorizationUrl(request, redirectUri, verifier, state, nonce);
        return context.loginPrompter()
                .promptForAuthorizationCode(url)
                .map(String::trim)
                .filter(c -> !c.isEmpty())
                .orElseThrow(() -> new AuthorizationCodeException(
                        Reason.USER_CANCELLED, "No authorization code was entered"));
    }

    private String authorizationUrl(
            LoginRequest request, String redirectUri, String verifier, String state, String nonce) {
        return authorizationClient()
                .authorizationUrl(new AuthorizationRequest(
                        config.clientId(),
                        redirectUri,
                        state,
                        nonce,
                        context.pkceService().generateChallenge(verifier),
                        scopesOrDefault(request.requestedScopes()),
                        audiencesOrDefault(request.requestedAudiences()),
                        extraWithDefaults(request.extra())));
    }

    private static void checkNonce(OidcCredential credential, String nonce) {
        final var idToken = credential.idToken().filter(t -> !t.isBlank());
        if (idToken.isEmpty()) {
            return;
        }
        final var tokenNonce = UnverifiedJwt.decode(idToken.get()).nonce();
        if (tokenNonce.isEmpty() || !nonce.equals(tokenNonce.get())) {
            throw new AuthorizationCodeException(
                    Reason.NONCE_MISMATCH, "ID token nonce does not match the nonce of the authorization request");
        }
    }

    /**
     * The acknowledgement page for the local callback listener, or null for the listener's default.
     */
    private String callbackAcknowledgement() {
        if (config.callbackAcknowledgement() != null) {
            return config.callbackAcknowledgement();
        }
        final var file = config.callbackAcknowledgementFile();
        if (file != null) {
            try {
                return Files.readString(file);
            } catch (IOException e) {
                throw new ConfigException("Cannot read authorization callback acknowledgement file " + file, e);
            }
        }
        return context.config().authCode().defaultAcknowledgement().orElse(null);
    }
}
