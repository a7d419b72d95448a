package authkit.core.service.auth;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;

import authkit.core.exception.TokenValidationException;
import authkit.core.exception.TokenValidationException.Kind;
import authkit.core.model.auth.UnverifiedJwt;
import authkit.core.model.auth.ValidatedClaims;
import authkit.core.port.out.JwksCache;

/**
 * Validates signed JWTs against a JWKS endpoint.
 *
 * <p>Checks, in order:
 * <ul>
 *   <li>the token decodes and is signed with an asymmetric algorithm</li>
 *   <li>the signing key ID is present in the key set</li>
 *   <li>the signature verifies</li>
 *   <li>{@code iss} equals the expected issuer exactly</li>
 *   <li>{@code aud} contains the single required audience</li>
 *   <li>the current time is within {@code nbf}/{@code exp}, allowing for clock skew</li>
 *   <li>if scopes were given, the token holds at least one of them</li>
 * </ul>
 */
public class TokenValidator {

    private static final Logger LOG = Logger.getLogger(TokenValidator.class);

    private static final Set<String> ALLOWED_ALGORITHMS = Set.of(
            AlgorithmIdentifiers.RSA_USING_SHA256,
            AlgorithmIdentifiers.RSA_USING_SHA384,
            AlgorithmIdentifiers.RSA_USING_SHA512,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA256,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA384,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA512,
            AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256,
            AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384,
            AlgorithmIdentifiers.ECDSA_USING_P521_CURVE_AND_SHA512);

    private final JwksCache jwksCache;
    private final URI jwksUri;
    private final Duration clockSkew;
    private final Clock clock;

    public TokenValidator(JwksCache jwksCache, URI jwksUri, Duration clockSkew, Clock clock) {
        this.jwksCache = jwksCache;
        this.jwksUri = jwksUri;
        this.clockSkew = clockSkew;
        this.clock = clock;
    }

    public URI jwksUri() {
        return jwksUri;
    }

    /**
     * Validate a token for a single audience.
     *
     * @param token        the compact JWT
     * @param issuer       the expected issuer
     * @param audience     the audience the token must include
     * @param scopesAnyOf  scopes of which at least one must be granted; empty to skip the check
     * @return the verified claims
     * @throws TokenValidationException with the specific failure kind
     */
    public ValidatedClaims validateToken(String token, String issuer, String audience, Collection<String> scopesAnyOf) {
        requireArgument(token, "token");
        requireArgument(issuer, "issuer");
        requireArgument(audience, "audience");

        final var unverified = UnverifiedJwt.decode(token);
        final var algorithm = unverified.algorithm().orElse(null);
        if (algorithm == null || !ALLOWED_ALGORITHMS.contains(algorithm)) {
            throw new TokenValidationException(
                    Kind.INVALID_ALGORITHM, "Token signing algorithm not allowed: " + algorithm);
        }

        final var keyId = unverified.keyId().orElse(null);
        final var key = jwksCache.getKey(jwksUri, keyId)
                .orElseThrow(() -> new TokenValidationException(
                        Kind.UNKNOWN_SIGNING_KEY, "Could not find signing key for key ID " + keyId));

        final JwtClaims claims;
        try {
            claims = new JwtConsumerBuilder()
                    .setRequireExpirationTime()
                    .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                    .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
                    .setExpectedIssuer(true, issuer)
                    .setExpectedAudience(audience)
                    .setVerificationKey(key.getKey())
                    .setJwsAlgorithmConstraints(new AlgorithmConstraints(
                            AlgorithmConstraints.ConstraintType.PERMIT, ALLOWED_ALGORITHMS.toArray(new String[0])))
                    .build()
                    .processToClaims(token);
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            throw toValidationException(e);
        }

        if (scopesAnyOf != null && !scopesAnyOf.isEmpty()) {
            checkScopes(claims, scopesAnyOf);
        }
        return toValidatedClaims(claims);
    }

    /**
     * Validate an ID token. The audience must be the client ID.
     */
    public ValidatedClaims validateIdToken(String token, String issuer, String clientId) {
        return validateToken(token, issuer, clientId, List.of());
    }

    private static void requireArgument(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new TokenValidationException(Kind.MALFORMED_ARGUMENT, name + " must not be empty");
        }
    }

    private static void checkScopes(JwtClaims claims, Collection<String> scopesAnyOf) {
        final var granted = new HashSet<String>();
        final var scope = claims.getClaimValue("scope");
        if (scope instanceof String s) {
            granted.addAll(List.of(s.trim().split("\\s+")));
        } else if (scope instanceof Collection<?> c) {
            c.forEach(v -> granted.add(String.valueOf(v)));
        }
        final var scp = claims.getClaimValue("scp");
        if (scp instanceof Collection<?> c) {
            c.forEach(v -> granted.add(String.valueOf(v)));
        } else if (scp instanceof String s) {
            granted.addAll(List.of(s.trim().split("\\s+")));
        }
        for (var required : scopesAnyOf) {
            if (granted.contains(required)) {
                return;
            }
        }
        throw new TokenValidationException(
                Kind.MISSING_REQUIRED_SCOPE, "Token does not hold any of the required scopes " + scopesAnyOf);
    }

    private static ValidatedClaims toValidatedClaims(JwtClaims claims) {
        try {
            final var expiration = claims.getExpirationTime();
            return new ValidatedClaims(
                    claims.getIssuer(),
                    claims.getSubject(),
                    expiration == null ? 0L : expiration.getValue(),
                    claims.getClaimsMap());
        } catch (MalformedClaimException e) {
            throw new TokenValidationException(Kind.MALFORMED_ARGUMENT, "Malformed claims: " + e.getMessage(), e);
        }
    }

    private static TokenValidationException toValidationException(InvalidJwtException e) {
        if (e.hasExpired()) {
            return new TokenValidationException(Kind.EXPIRED, "Token has expired", e);
        }
        if (e.hasErrorCode(ErrorCodes.NOT_YET_VALID)) {
            return new TokenValidationException(Kind.NOT_YET_VALID, "Token is not yet valid", e);
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID) || e.hasErrorCode(ErrorCodes.ISSUER_MISSING)) {
            return new TokenValidationException(Kind.WRONG_ISSUER, "Invalid token issuer", e);
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID) || e.hasErrorCode(ErrorCodes.AUDIENCE_MISSING)) {
            return new TokenValidationException(Kind.WRONG_AUDIENCE, "Invalid token audience", e);
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return new TokenValidationException(Kind.INVALID_SIGNATURE, "Invalid token signature", e);
        }
        return new TokenValidationException(Kind.MALFORMED_ARGUMENT, "Token validation failed: " + e.getMessage(), e);
    }
}
