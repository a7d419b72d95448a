package authkit.core.model.config;

import java.nio.file.Path;

/**
 * Client authentication material, one variant per {@link ClientAuthKind}.
 */
public sealed interface ClientAuthentication {

    ClientAuthKind kind();

    /**
     * Public client.
     */
    record None() implements ClientAuthentication {
        @Override
        public ClientAuthKind kind() {
            return ClientAuthKind.NONE;
        }
    }

    /**
     * Shared secret, sent either as HTTP Basic credentials or as form fields.
     *
     * @param secret    the client secret
     * @param placement where the secret is presented
     */
    record ClientSecret(String secret, SecretPlacement placement) implements ClientAuthentication {
        public ClientSecret {
            if (placement == null) {
                placement = SecretPlacement.BASIC;
            }
        }

        @Override
        public ClientAuthKind kind() {
            return ClientAuthKind.CLIENT_SECRET;
        }

        @Override
        public String toString() {
            return "ClientSecret[placement=" + placement + "]";
        }
    }

    /**
     * Private key used to sign {@code private_key_jwt} client assertions.
     *
     * @param privateKeyPem      PEM literal, or null when read from file
     * @param privateKeyFile     PEM file, or null when given as a literal
     * @param privateKeyPassword password for an encrypted PKCS8 key, may be null
     */
    record PrivateKeyJwt(String privateKeyPem, Path privateKeyFile, String privateKeyPassword)
            implements ClientAuthentication {
        @Override
        public ClientAuthKind kind() {
            return ClientAuthKind.PRIVATE_KEY_JWT;
        }

        @Override
        public String toString() {
            return "PrivateKeyJwt[privateKeyFile=" + privateKeyFile + "]";
        }
    }

    enum SecretPlacement {
        BASIC("client_secret_basic"),
        POST("client_secret_post");

        private final String wireName;

        SecretPlacement(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static SecretPlacement fromWireName(String value) {
            for (var placement : values()) {
                if (placement.wireName.equalsIgnoreCase(value)) {
                    return placement;
                }
            }
            throw new IllegalArgumentException("Unknown client secret auth method: " + value);
        }
    }
}
