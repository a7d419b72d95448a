package authkit.core.model.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import authkit.core.exception.ConfigException;

/**
 * Configuration shared by every OAuth2/OIDC client type.
 *
 * @param clientType                  one of the OIDC client types
 * @param authServer                  base URL of the authorization server (required)
 * @param clientId                    client identifier (required)
 * @param issuer                      expected issuer, when it differs from discovery
 * @param audiences                   requested audiences; at most one value
 * @param scopes                      default requested scopes
 * @param organization                organization hint passed to the server
 * @param projectId                   project hint passed to the server
 * @param endpoints                   endpoint overrides
 * @param clientAuthentication        client credentials matching the client type
 * @param localRedirectUri            redirect URI served by the local callback listener
 * @param remoteRedirectUri           redirect URI used for manual code entry
 * @param callbackAcknowledgement     HTML served after a callback is received
 * @param callbackAcknowledgementFile file holding the acknowledgement HTML
 * @param username                    resource owner username
 * @param password                    resource owner password
 */
public record OidcClientConfig(
        ClientType clientType,
        String authServer,
        String clientId,
        String issuer,
        List<String> audiences,
        List<String> scopes,
        String organization,
        String projectId,
        OidcEndpoints endpoints,
        ClientAuthentication clientAuthentication,
        String localRedirectUri,
        String remoteRedirectUri,
        String callbackAcknowledgement,
        Path callbackAcknowledgementFile,
        String username,
        String password)
        implements AuthClientConfig {

    public static final String DEFAULT_LOCAL_REDIRECT_URI = "http://localhost:8080";

    public OidcClientConfig {
        if (clientType == null || !clientType.isOidc()) {
            throw new ConfigException("An OIDC client type is required, got " + clientType);
        }
        if (authServer == null || authServer.isBlank()) {
            throw new ConfigException("auth_server must be configured for " + clientType.wireName() + " auth client");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new ConfigException("client_id must be configured for " + clientType.wireName() + " auth client");
        }
        audiences = audiences == null ? List.of() : List.copyOf(audiences);
        if (audiences.size() > 1) {
            throw new ConfigException("while it is a list type, audiences is only permitted to have one value for "
                    + clientType.wireName() + " auth client");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        if (endpoints == null) {
            endpoints = OidcEndpoints.none();
        }
        if (clientAuthentication == null) {
            clientAuthentication = new ClientAuthentication.None();
        }
        final var expectedAuth = clientType.clientAuthKind().orElseThrow();
        if (clientAuthentication.kind() != expectedAuth) {
            throw new ConfigException(describeMissingClientAuth(clientType, expectedAuth));
        }
        if (clientAuthentication instanceof ClientAuthentication.ClientSecret secret
                && (secret.secret() == null || secret.secret().isBlank())) {
            throw new ConfigException(describeMissingClientAuth(clientType, expectedAuth));
        }
        if (clientAuthentication instanceof ClientAuthentication.PrivateKeyJwt key
                && (key.privateKeyPem() == null || key.privateKeyPem().isBlank())
                && key.privateKeyFile() == null) {
            throw new ConfigException(describeMissingClientAuth(clientType, expectedAuth));
        }
        if (localRedirectUri == null || localRedirectUri.isBlank()) {
            localRedirectUri = DEFAULT_LOCAL_REDIRECT_URI;
        }
    }

    private static String describeMissingClientAuth(ClientType type, ClientAuthKind kind) {
        return switch (kind) {
            case NONE -> type.wireName() + " auth client is a public client and must not carry client credentials";
            case CLIENT_SECRET -> "client_secret must be configured for " + type.wireName() + " auth client";
            case PRIVATE_KEY_JWT -> "client_privkey or client_privkey_file must be configured for " + type.wireName()
                    + " auth client";
        };
    }

    public GrantFlow grantFlow() {
        return clientType.grantFlow().orElseThrow();
    }

    public Optional<String> configuredIssuer() {
        return Optional.ofNullable(issuer).filter(s -> !s.isBlank());
    }

    public Optional<String> configuredOrganization() {
        return Optional.ofNullable(organization).filter(s -> !s.isBlank());
    }

    public Optional<String> configuredProjectId() {
        return Optional.ofNullable(projectId).filter(s -> !s.isBlank());
    }

    public Optional<String> configuredRemoteRedirectUri() {
        return Optional.ofNullable(remoteRedirectUri).filter(s -> !s.isBlank());
    }

    @Override
    public Map<String, Object> toMap() {
        final var map = new LinkedHashMap<String, Object>();
        map.put(AuthClientConfigs.CLIENT_TYPE, clientType.wireName());
        map.put("auth_server", authServer);
        map.put("client_id", clientId);
        putIfPresent(map, "issuer", issuer);
        if (!audiences.isEmpty()) {
            map.put("audiences", audiences);
        }
        if (!scopes.isEmpty()) {
            map.put("scopes", scopes);
        }
        putIfPresent(map, "organization", organization);
        putIfPresent(map, "project_id", projectId);
        putIfPresent(map, "authorization_endpoint", endpoints.authorization());
        putIfPresent(map, "device_authorization_endpoint", endpoints.deviceAuthorization());
        putIfPresent(map, "token_endpoint", endpoints.token());
        putIfPresent(map, "introspection_endpoint", endpoints.introspection());
        putIfPresent(map, "revocation_endpoint", endpoints.revocation());
        putIfPresent(map, "userinfo_endpoint", endpoints.userinfo());
        putIfPresent(map, "jwks_endpoint", endpoints.jwks());
        if (clientAuthentication instanceof ClientAuthentication.ClientSecret secret) {
            map.put("client_secret", secret.secret());
            map.put("client_auth_method", secret.placement().wireName());
        } else if (clientAuthentication instanceof ClientAuthentication.PrivateKeyJwt key) {
            putIfPresent(map, "client_privkey", key.privateKeyPem());
            final var keyFile = key.privateKeyFile();
            putIfPresent(map, "client_privkey_file", keyFile == null ? null : keyFile.toString());
            putIfPresent(map, "client_privkey_password", key.privateKeyPassword());
        }
        map.put("local_redirect_uri", localRedirectUri);
        putIfPresent(map, "remote_redirect_uri", remoteRedirectUri);
        putIfPresent(map, "authorization_callback_acknowledgement", callbackAcknowledgement);
        putIfPresent(
                map,
                "authorization_callback_acknowledgement_file",
                callbackAcknowledgementFile == null ? null : callbackAcknowledgementFile.toString());
        putIfPresent(map, "username", username);
        putIfPresent(map, "password", password);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    @Override
    public String toString() {
        return "OidcClientConfig[clientType=" + clientType + ", authServer=" + authServer + ", clientId=" + clientId
                + ", audiences=" + audiences + ", scopes=" + scopes + ", clientAuthentication="
                + clientAuthentication + "]";
    }

    /**
     * Builder for OidcClientConfig.
     */
    public static Builder builder(ClientType clientType, String authServer, String clientId) {
        return new Builder(clientType, authServer, clientId);
    }

    public static class Builder {
        private final ClientType clientType;
        private final String authServer;
        private final String clientId;
        private String issuer;
        private List<String> audiences = List.of();
        private List<String> scopes = List.of();
        private String organization;
        private String projectId;
        private OidcEndpoints endpoints = OidcEndpoints.none();
        private ClientAuthentication clientAuthentication = new ClientAuthentication.None();
        private String localRedirectUri;
        private String remoteRedirectUri;
        private String callbackAcknowledgement;
        private Path callbackAcknowledgementFile;
        private String username;
        private String password;

        private Builder(ClientType clientType, String authServer, String clientId) {
            this.clientType = clientType;
            this.authServer = authServer;
            this.clientId = clientId;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audiences(List<String> audiences) {
            this.audiences = audiences;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder endpoints(OidcEndpoints endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public Builder clientAuthentication(ClientAuthentication clientAuthentication) {
            this.clientAuthentication = clientAuthentication;
            return this;
        }

        public Builder clientSecret(String secret) {
            this.clientAuthentication =
                    new ClientAuthentication.ClientSecret(secret, ClientAuthentication.SecretPlacement.BASIC);
            return this;
        }

        public Builder localRedirectUri(String localRedirectUri) {
            this.localRedirectUri = localRedirectUri;
            return this;
        }

        public Builder remoteRedirectUri(String remoteRedirectUri) {
            this.remoteRedirectUri = remoteRedirectUri;
            return this;
        }

        public Builder callbackAcknowledgement(String callbackAcknowledgement) {
            this.callbackAcknowledgement = callbackAcknowledgement;
            return this;
        }

        public Builder callbackAcknowledgementFile(Path callbackAcknowledgementFile) {
            this.callbackAcknowledgementFile = callbackAcknowledgementFile;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public OidcClientConfig build() {
            return new OidcClientConfig(
                    clientType,
                    authServer,
                    clientId,
                    issuer,
                    audiences,
                    scopes,
                    organization,
                    projectId,
                    endpoints,
                    clientAuthentication,
                    localRedirectUri,
                    remoteRedirectUri,
                    callbackAcknowledgement,
                    callbackAcknowledgementFile,
                    username,
                    password);
        }
    }
}
