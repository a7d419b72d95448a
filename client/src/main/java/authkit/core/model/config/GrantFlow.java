package authkit.core.model.config;

/**
 * OAuth2 exchange pattern used by an OIDC client type.
 */
public enum GrantFlow {
    AUTHORIZATION_CODE,
    DEVICE_CODE,
    CLIENT_CREDENTIALS,
    RESOURCE_OWNER_PASSWORD,
    VALIDATION_ONLY
}
