package authkit.core.model.auth;

import java.util.Map;
import java.util.Optional;

import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import authkit.core.exception.TokenValidationException;
import authkit.core.util.JsonMaps;

/**
 * Claims of a JWT read WITHOUT checking its signature.
 *
 * <p>Only for inspecting tokens we hold ourselves, such as deciding when to
 * refresh an access token or reading the issuer to pick a trust entry. Nothing
 * read from here may be trusted. Use {@link authkit.core.service.auth.TokenValidator}
 * to establish trust.
 */
public final class UnverifiedJwt {

    private final String keyId;
    private final String algorithm;
    private final Map<String, Object> claims;

    private UnverifiedJwt(String keyId, String algorithm, Map<String, Object> claims) {
        this.keyId = keyId;
        this.algorithm = algorithm;
        this.claims = claims;
    }

    /**
     * Decode a compact JWT without verification.
     *
     * @param token the compact serialization
     * @return the decoded token
     * @throws TokenValidationException with kind MALFORMED_ARGUMENT if the token cannot be decoded
     */
    public static UnverifiedJwt decode(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(TokenValidationException.Kind.MALFORMED_ARGUMENT, "Token is empty");
        }
        try {
            final var context = new JwtConsumerBuilder()
                    .setSkipSignatureVerification()
                    .setSkipAllValidators()
                    .setDisableRequireSignature()
                    .setSkipAllDefaultValidators()
                    .build()
                    .process(token);
            final var header = context.getJoseObjects().isEmpty() ? null : context.getJoseObjects().get(0);
            final JwtClaims jwtClaims = context.getJwtClaims();
            return new UnverifiedJwt(
                    header == null ? null : header.getKeyIdHeaderValue(),
                    header == null ? null : header.getAlgorithmHeaderValue(),
                    Map.copyOf(JsonMaps.withoutNulls(jwtClaims.getClaimsMap())));
        } catch (InvalidJwtException e) {
            throw new TokenValidationException(
                    TokenValidationException.Kind.MALFORMED_ARGUMENT, "Token could not be decoded as a JWT", e);
        }
    }

    public Optional<String> keyId() {
        return Optional.ofNullable(keyId);
    }

    public Optional<String> algorithm() {
        return Optional.ofNullable(algorithm);
    }

    public Map<String, Object> claims() {
        return claims;
    }

    public Optional<String> issuer() {
        return stringClaim("iss");
    }

    public Optional<String> subject() {
        return stringClaim("sub");
    }

    public Optional<String> nonce() {
        return stringClaim("nonce");
    }

    public Optional<String> stringClaim(String name) {
        return JsonMaps.string(claims, name);
    }

    public Optional<Long> issuedAt() {
        return JsonMaps.number(claims, "iat");
    }

    public Optional<Long> expiresAt() {
        return JsonMaps.number(claims, "exp");
    }

    /**
     * Epoch second at three quarters of the token's lifetime. Missing
     * {@code iat} or {@code exp} count as zero.
     */
    public long refreshAt() {
        final long iat = issuedAt().orElse(0L);
        final long exp = expiresAt().orElse(0L);
        return iat + (3 * (exp - iat)) / 4;
    }
}
