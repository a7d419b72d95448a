package authkit.core.model.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every supported {@code client_type} value.
 *
 * <p>Both {@code oidc_auth_code} and {@code oidc-auth-code} spellings are accepted on parse.
 */
public enum ClientType {
    OIDC_AUTH_CODE("oidc_auth_code", GrantFlow.AUTHORIZATION_CODE, ClientAuthKind.NONE),
    OIDC_AUTH_CODE_SECRET("oidc_auth_code_secret", GrantFlow.AUTHORIZATION_CODE, ClientAuthKind.CLIENT_SECRET),
    OIDC_AUTH_CODE_PUBKEY("oidc_auth_code_pubkey", GrantFlow.AUTHORIZATION_CODE, ClientAuthKind.PRIVATE_KEY_JWT),
    OIDC_CLIENT_CREDENTIALS_SECRET(
            "oidc_client_credentials_secret", GrantFlow.CLIENT_CREDENTIALS, ClientAuthKind.CLIENT_SECRET),
    OIDC_CLIENT_CREDENTIALS_PUBKEY(
            "oidc_client_credentials_pubkey", GrantFlow.CLIENT_CREDENTIALS, ClientAuthKind.PRIVATE_KEY_JWT),
    OIDC_DEVICE_CODE("oidc_device_code", GrantFlow.DEVICE_CODE, ClientAuthKind.NONE),
    OIDC_DEVICE_CODE_SECRET("oidc_device_code_secret", GrantFlow.DEVICE_CODE, ClientAuthKind.CLIENT_SECRET),
    OIDC_DEVICE_CODE_PUBKEY("oidc_device_code_pubkey", GrantFlow.DEVICE_CODE, ClientAuthKind.PRIVATE_KEY_JWT),
    OIDC_RESOURCE_OWNER("oidc_resource_owner", GrantFlow.RESOURCE_OWNER_PASSWORD, ClientAuthKind.NONE),
    OIDC_RESOURCE_OWNER_SECRET(
            "oidc_resource_owner_secret", GrantFlow.RESOURCE_OWNER_PASSWORD, ClientAuthKind.CLIENT_SECRET),
    OIDC_RESOURCE_OWNER_PUBKEY(
            "oidc_resource_owner_pubkey", GrantFlow.RESOURCE_OWNER_PASSWORD, ClientAuthKind.PRIVATE_KEY_JWT),
    OIDC_CLIENT_VALIDATOR("oidc_client_validator", GrantFlow.VALIDATION_ONLY, ClientAuthKind.NONE),
    PLANET_LEGACY("planet_legacy", null, null),
    STATIC_API_KEY("static_apikey", null, null),
    NONE("none", null, null);

    private final String wireName;
    private final GrantFlow grantFlow;
    private final ClientAuthKind clientAuthKind;

    ClientType(String wireName, GrantFlow grantFlow, ClientAuthKind clientAuthKind) {
        this.wireName = wireName;
        this.grantFlow = grantFlow;
        this.clientAuthKind = clientAuthKind;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isOidc() {
        return grantFlow != null;
    }

    public Optional<GrantFlow> grantFlow() {
        return Optional.ofNullable(grantFlow);
    }

    public Optional<ClientAuthKind> clientAuthKind() {
        return Optional.ofNullable(clientAuthKind);
    }

    /**
     * Resolve a configured {@code client_type} string.
     *
     * @param value the configured value, hyphen or underscore separated
     * @return the matching type, or empty if unknown
     */
    public static Optional<ClientType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        final var normalized = value.trim().toLowerCase().replace('-', '_');
        final var lookup = "static_api_key".equals(normalized) ? STATIC_API_KEY.wireName : normalized;
        return Arrays.stream(values()).filter(t -> t.wireName.equals(lookup)).findFirst();
    }
}
