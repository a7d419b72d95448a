package authkit.core.service.client;

import java.net.URI;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import authkit.core.AuthContext;
import authkit.core.exception.ConfigException;
import authkit.core.model.auth.ValidatedClaims;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.model.credential.Credential;
import authkit.core.model.credential.OidcCredential;
import authkit.core.service.auth.ClientAuthEnrichers;
import authkit.core.service.auth.TokenValidator;
import authkit.core.service.oidc.AuthorizationApiClient;
import authkit.core.service.oidc.ClientAuthEnricher;
import authkit.core.service.oidc.DeviceAuthorizationApiClient;
import authkit.core.service.oidc.DiscoveryApiClient;
import authkit.core.service.oidc.IntrospectionApiClient;
import authkit.core.service.oidc.RevocationApiClient;
import authkit.core.service.oidc.TokenApiClient;
import authkit.core.service.oidc.UserinfoApiClient;
import authkit.core.service.request.CredentialRequestAuthenticator;
import authkit.core.service.request.RefreshingOidcTokenRequestAuthenticator;
import authkit.core.util.JsonMaps;

/**
 * Base for every OAuth2/OIDC client.
 *
 * <p>Endpoints are resolved on first use, from the client config when set there,
 * otherwise from the server's discovery document. Login requests fall back to the
 * configured scopes, audiences, organization and project when they leave them unset.
 *
 * <p>Not thread-safe.
 */
public abstract sealed class OidcAuthClient implements AuthClient, Refreshable
        permits AuthCodeAuthClient,
                DeviceCodeAuthClient,
                ClientCredentialsAuthClient,
                ResourceOwnerAuthClient,
                ClientValidatorAuthClient {

    private static final Logger LOG = Logger.getLogger(OidcAuthClient.class);

    static final String EXTRA_ORGANIZATION = "organization";
    static final String EXTRA_PROJECT_ID = "project_id";

    protected final OidcClientConfig config;
    protected final AuthContext context;
    protected final ClientAuthEnricher enricher;
    private final DiscoveryApiClient discoveryClient;

    private TokenApiClient tokenClient;
    private AuthorizationApiClient authorizationClient;
    private DeviceAuthorizationApiClient deviceAuthorizationClient;
    private IntrospectionApiClient introspectionClient;
    private RevocationApiClient revocationClient;
    private UserinfoApiClient userinfoClient;
    private TokenValidator tokenValidator;

    protected OidcAuthClient(OidcClientConfig config, AuthContext context) {
        this.config = config;
        this.context = context;
        this.enricher = ClientAuthEnrichers.forConfig(config, context.clock());
        this.discoveryClient =
                new DiscoveryApiClient(context.transport(), config.authServer(), context.config().http());
    }

    @Override
    public OidcClientConfig config() {
        return config;
    }

    // Discovery and endpoints

    /**
     * The server's discovery document, fetched once per client.
     */
    public Map<String, Object> discovery() {
        return discoveryClient.discovery();
    }

    /**
     * The issuer tokens from this client's server carry.
     */
    public String issuer() {
        return config.configuredIssuer()
                .or(() -> JsonMaps.string(discovery(), "issuer"))
                .orElseThrow(() -> new ConfigException(
                        "Issuer is not configured and the discovery document of " + config.authServer()
                                + " does not provide one"));
    }

    /**
     * Scopes advertised by the server.
     */
    public List<String> getScopes() {
        return JsonMaps.stringList(discovery(), "scopes_supported");
    }

    private String endpoint(Optional<String> configured, String discoveryKey) {
        if (configured.isPresent() && !configured.get().isBlank()) {
            return configured.get();
        }
        return JsonMaps.string(discovery(), discoveryKey)
                .filter(v -> !v.isBlank())
                .orElseThrow(() -> new ConfigException(discoveryKey + " is not configured for "
                        + config.clientType().wireName() + " auth client and was not found in the discovery"
                        + " document of " + config.authServer()));
    }

    protected TokenApiClient tokenClient() {
        if (tokenClient == null) {
            tokenClient = new TokenApiClient(
                    context.transport(),
                    endpoint(config.endpoints().tokenEndpoint(), "token_endpoint"),
                    context.config().http());
        }
        return tokenClient;
    }

    protected AuthorizationApiClient authorizationClient() {
        if (authorizationClient == null) {
            authorizationClient = new AuthorizationApiClient(
                    endpoint(config.endpoints().authorizationEndpoint(), "authorization_endpoint"));
        }
        return authorizationClient;
    }

    protected DeviceAuthorizationApiClient deviceAuthorizationClient() {
        if (deviceAuthorizationClient == null) {
            deviceAuthorizationClient = new DeviceAuthorizationApiClient(
                    context.transport(),
                    endpoint(config.endpoints().deviceAuthorizationEndpoint(), "device_authorization_endpoint"),
                    context.config().http());
        }
        return deviceAuthorizationClient;
    }

    protected IntrospectionApiClient introspectionClient() {
        if (introspectionClient == null) {
            introspectionClient = new IntrospectionApiClient(
                    context.transport(),
                    endpoint(config.endpoints().introspectionEndpoint(), "introspection_endpoint"),
                    context.config().http());
        }
        return introspectionClient;
    }

    protected RevocationApiClient revocationClient() {
        if (revocationClient == null) {
            revocationClient = new RevocationApiClient(
                    context.transport(),
                    endpoint(config.endpoints().revocationEndpoint(), "revocation_endpoint"),
                    context.config().http());
        }
        return revocationClient;
    }

    protected UserinfoApiClient userinfoClient() {
        if (userinfoClient == null) {
            userinfoClient = new UserinfoApiClient(
                    context.transport(),
                    endpoint(config.endpoints().userinfoEndpoint(), "userinfo_endpoint"),
                    context.config().http());
        }
        return userinfoClient;
    }

    /**
     * Validator for tokens signed by this client's server.
     */
    public TokenValidator tokenValidator() {
        if (tokenValidator == null) {
            final var jwksUri = endpoint(config.endpoints().jwksEndpoint(), "jwks_uri");
            tokenValidator = new TokenValidator(
                    context.jwksCache(),
                    URI.create(jwksUri),
                    context.config().validation().clockSkew(),
                    context.clock());
        }
        return tokenValidator;
    }

    // Config fallback

    protected List<String> scopesOrDefault(List<String> requested) {
        return requested == null || requested.isEmpty() ? config.scopes() : requested;
    }

    protected List<String> audiencesOrDefault(List<String> requested) {
        return requested == null || requested.isEmpty() ? config.audiences() : requested;
    }

    protected Map<String, String> extraWithDefaults(Map<String, String> extra) {
        final var merged = new LinkedHashMap<String, String>();
        if (extra != null) {
            merged.putAll(extra);
        }
        config.configuredOrganization().ifPresent(org -> merged.putIfAbsent(EXTRA_ORGANIZATION, org));
        config.configuredProjectId().ifPresent(project -> merged.putIfAbsent(EXTRA_PROJECT_ID, project));
        return merged;
    }

    protected OidcCredential credentialFrom(Map<String, Object> tokenResponse) {
        return OidcCredential.fromTokenResponse(tokenResponse, context.documentStore(), context.clock());
    }

    // Refresh

    @Override
    public OidcCredential refresh(String refreshToken, List<String> requestedScopes, Map<String, String> extra) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new IllegalArgumentException("refreshToken cannot be null or blank");
        }
        final var response = new LinkedHashMap<>(
                tokenClient().getTokenFromRefresh(config.clientId(), refreshToken, requestedScopes, extra, enricher));
        // Servers that do not rotate refresh tokens omit them from the response
        response.putIfAbsent(OidcCredential.REFRESH_TOKEN, refreshToken);
        LOG.debugf("Refreshed tokens for client %s", config.clientId());
        return credentialFrom(response);
    }

    // Validation

    /**
     * Validate an access token locally against the server's published keys.
     *
     * @param accessToken    the token
     * @param audience       required audience, or null to use the single configured audience
     * @param scopesAnyOf    scopes of which the token must carry at least one, may be empty
     * @throws ConfigException if no audience is given and the config does not hold exactly one
     */
    public ValidatedClaims validateAccessTokenLocal(
            String accessToken, String audience, Collection<String> scopesAnyOf) {
        return tokenValidator().validateToken(accessToken, issuer(), resolveAudience(audience), scopesAnyOf);
    }

    private String resolveAudience(String audience) {
        if (audience != null && !audience.isBlank()) {
            return audience;
        }
        final var configured = config.audiences();
        if (configured.size() != 1) {
            throw new ConfigException("Exactly one audience must be configured for "
                    + config.clientType().wireName() + " auth client to validate access tokens without an"
                    + " explicit audience, found " + configured.size());
        }
        return configured.get(0);
    }

    public Map<String, Object> validateAccessTokenRemote(String accessToken) {
        return introspectionClient().validateAccessToken(accessToken, enricher);
    }

    /**
     * Validate an ID token locally. The audience is this client's ID.
     */
    public ValidatedClaims validateIdTokenLocal(String idToken) {
        return tokenValidator().validateIdToken(idToken, issuer(), config.clientId());
    }

    public Map<String, Object> validateIdTokenRemote(String idToken) {
        return introspectionClient().validateIdToken(idToken, enricher);
    }

    public Map<String, Object> validateRefreshTokenRemote(String refreshToken) {
        return introspectionClient().validateRefreshToken(refreshToken, enricher);
    }

    // Revocation and userinfo

    public void revokeAccessToken(String accessToken) {
        revocationClient().revokeAccessToken(accessToken, enricher);
    }

    public void revokeRefreshToken(String refreshToken) {
        revocationClient().revokeRefreshToken(refreshToken, enricher);
    }

    public Map<String, Object> userinfoFromAccessToken(String accessToken) {
        return userinfoClient().userinfoFromAccessToken(accessToken);
    }

    // Request authenticators

    @Override
    public OidcCredential credentialForFile(Path path) {
        return new OidcCredential(null, path, context.documentStore(), context.clock());
    }

    /**
     * Refreshes tokens but never logs in on its own. Interactive flows use this.
     */
    @Override
    public CredentialRequestAuthenticator defaultRequestAuthenticator(Credential credential) {
        return new RefreshingOidcTokenRequestAuthenticator(requireOidcCredential(credential), this, context.clock());
    }

    protected static OidcCredential requireOidcCredential(Credential credential) {
        if (!(credential instanceof OidcCredential)) {
            throw new IllegalArgumentException("OIDC auth clients require an OidcCredential, got "
                    + (credential == null ? "null" : credential.getClass().getSimpleName()));
        }
        return (OidcCredential) credential;
    }
}
