package authkit.core.service.client;

import java.nio.file.Path;

import org.jboss.logging.Logger;

import authkit.core.AuthContext;
import authkit.core.exception.AuthException;
import authkit.core.exception.ProtocolException;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.auth.UnverifiedJwt;
import authkit.core.model.config.PlanetLegacyClientConfig;
import authkit.core.model.credential.Credential;
import authkit.core.model.credential.LegacyApiKeyCredential;
import authkit.core.service.legacy.LegacyAuthApiClient;
import authkit.core.service.request.CredentialRequestAuthenticator;
import authkit.core.service.request.LegacyApiKeyRequestAuthenticator;
import authkit.spi.LoginPrompter.UsernamePassword;

/**
 * Legacy username/password login that yields a long-lived API key.
 *
 * <p>The login endpoint returns a JWT whose {@code api_key} claim is the key. The
 * JWT is kept alongside the key but not verified, since it only transports the key.
 */
public final class PlanetLegacyAuthClient implements AuthClient, Loginable<LegacyApiKeyCredential> {

    private static final Logger LOG = Logger.getLogger(PlanetLegacyAuthClient.class);

    static final String API_KEY_CLAIM = "api_key";

    private final PlanetLegacyClientConfig config;
    private final AuthContext context;
    private final LegacyAuthApiClient apiClient;

    public PlanetLegacyAuthClient(PlanetLegacyClientConfig config, AuthContext context) {
        this.config = config;
        this.context = context;
        this.apiClient =
                new LegacyAuthApiClient(context.transport(), config.legacyAuthEndpoint(), context.config().http());
    }

    @Override
    public PlanetLegacyClientConfig config() {
        return config;
    }

    /**
     * Log in with the request's username and password, prompting for them if allowed.
     * A configured API key is used without contacting the server when no username is given.
     */
    @Override
    public LegacyApiKeyCredential login(LoginRequest request) {
        if (request.username() == null && config.configuredApiKey().isPresent()) {
            LOG.debugf("Using configured legacy API key");
            return LegacyApiKeyCredential.of(
                    config.configuredApiKey().get(), null, context.documentStore(), context.clock());
        }

        final var owner = resolveOwner(request);
        final var jwt = apiClient.login(owner.username(), owner.password());
        final var apiKey = UnverifiedJwt.decode(jwt)
                .stringClaim(API_KEY_CLAIM)
                .filter(k -> !k.isBlank())
                .orElseThrow(() -> new ProtocolException(
                        apiClient.endpointUri(),
                        200,
                        "Token from legacy login endpoint " + apiClient.endpointUri() + " has no api_key claim",
                        null));
        return LegacyApiKeyCredential.of(apiKey, jwt, context.documentStore(), context.clock());
    }

    private UsernamePassword resolveOwner(LoginRequest request) {
        if (request.username() != null && request.password() != null) {
            return new UsernamePassword(request.username(), request.password());
        }
        if (request.allowTtyPrompt()) {
            return context.loginPrompter()
                    .promptForUsernamePassword()
                    .orElseThrow(() -> new AuthException("Login cancelled, no username and password entered"));
        }
        throw new AuthException("A username and password are required for legacy login");
    }

    @Override
    public LegacyApiKeyCredential credentialForFile(Path path) {
        return new LegacyApiKeyCredential(null, path, context.documentStore(), context.clock());
    }

    @Override
    public CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential) {
        if (!(credential instanceof LegacyApiKeyCredential)) {
            throw new IllegalArgumentException("Legacy auth client requires a LegacyApiKeyCredential");
        }
        return new LegacyApiKeyRequestAuthenticator((LegacyApiKeyCredential) credential);
    }
}
