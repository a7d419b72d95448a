package authkit.core.model.auth;

import java.util.Map;
import java.util.Optional;

/**
 * Claims of a token whose signature and standard claims were verified.
 *
 * @param issuer    the token issuer (iss claim)
 * @param subject   the token subject (sub claim), may be null
 * @param expiresAt expiry in epoch seconds
 * @param claims    all claims from the token
 */
public record ValidatedClaims(String issuer, String subject, long expiresAt, Map<String, Object> claims) {

    public ValidatedClaims {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }

    public Optional<Object> claim(String name) {
        return Optional.ofNullable(claims.get(name));
    }
}
