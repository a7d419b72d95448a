package authkit.core.model.config;

/**
 * How a client proves its identity to token, introspection and revocation endpoints.
 */
public enum ClientAuthKind {
    /** Public client. Only the client ID is sent. */
    NONE,
    /** Confidential client holding a shared secret. */
    CLIENT_SECRET,
    /** Confidential client signing a JWT assertion with a private key. */
    PRIVATE_KEY_JWT
}
