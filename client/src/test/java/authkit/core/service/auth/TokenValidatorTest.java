package authkit.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import authkit.core.exception.TokenValidationException;
import authkit.core.exception.TokenValidationException.Kind;
import authkit.core.port.out.JwksCache;
import authkit.testsupport.TestTokens;

@DisplayName("TokenValidator")
@ExtendWith(MockitoExtension.class)
class TokenValidatorTest {

    private static final URI JWKS_URI = URI.create("https://auth.example.com/jwks");
    private static final long NOW = 1_700_000_000L;

    private static RsaJsonWebKey key;
    private static RsaJsonWebKey otherKey;

    @Mock
    private JwksCache jwksCache;

    private TokenValidator validator;

    @BeforeAll
    static void setUpKeys() {
        key = TestTokens.newKey("key-1");
        otherKey = TestTokens.newKey("key-2");
    }

    @BeforeEach
    void setUp() {
        final var clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        validator = new TokenValidator(jwksCache, JWKS_URI, Duration.ofSeconds(30), clock);
        lenient().when(jwksCache.getKey(JWKS_URI, "key-1")).thenReturn(Optional.of(key));
    }

    private static String token(JwtClaims claims) {
        return TestTokens.sign(key, claims);
    }

    private static JwtClaims validClaims() {
        return TestTokens.claims(TestTokens.ISSUER, TestTokens.AUDIENCE, NOW - 60, NOW + 3600);
    }

    private TokenValidationException failure(String token) {
        return assertThrows(TokenValidationException.class,
                () -> validator.validateToken(token, TestTokens.ISSUER, TestTokens.AUDIENCE, List.of()));
    }

    @Test
    @DisplayName("should return claims for a valid token")
    void shouldAcceptValidToken() {
        final var claims =
                validator.validateToken(token(validClaims()), TestTokens.ISSUER, TestTokens.AUDIENCE, List.of());

        assertEquals(TestTokens.ISSUER, claims.issuer());
        assertEquals(TestTokens.SUBJECT, claims.subject());
        assertEquals(NOW + 3600, claims.expiresAt());
    }

    @Test
    @DisplayName("should report UNKNOWN_SIGNING_KEY for a key missing from the JWKS")
    void shouldReportUnknownKey() {
        when(jwksCache.getKey(eq(JWKS_URI), eq("key-2"))).thenReturn(Optional.empty());

        final var error = failure(TestTokens.sign(otherKey, validClaims()));

        assertEquals(Kind.UNKNOWN_SIGNING_KEY, error.kind());
    }

    @Test
    @DisplayName("should report INVALID_SIGNATURE when the key ID matches but the signature does not")
    void shouldReportInvalidSignature() throws JoseException {
        final var forged = new JsonWebSignature();
        forged.setPayload(validClaims().toJson());
        forged.setKey(otherKey.getPrivateKey());
        forged.setKeyIdHeaderValue("key-1");
        forged.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);

        final var error = failure(forged.getCompactSerialization());

        assertEquals(Kind.INVALID_SIGNATURE, error.kind());
    }

    @Test
    @DisplayName("should report INVALID_ALGORITHM for symmetric signatures")
    void shouldRejectHmac() throws JoseException {
        final var jws = new JsonWebSignature();
        jws.setPayload(validClaims().toJson());
        jws.setKey(new HmacKey(new byte[32]));
        jws.setKeyIdHeaderValue("key-1");
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);

        final var error = failure(jws.getCompactSerialization());

        assertEquals(Kind.INVALID_ALGORITHM, error.kind());
        verify(jwksCache, never()).getKey(any(), any());
    }

    @Nested
    @DisplayName("claim checks")
    class ClaimTests {

        @Test
        @DisplayName("should report EXPIRED past exp plus skew")
        void shouldReportExpired() {
            final var error = failure(token(TestTokens.claims(
                    TestTokens.ISSUER, TestTokens.AUDIENCE, NOW - 3600, NOW - 120)));

            assertEquals(Kind.EXPIRED, error.kind());
        }

        @Test
        @DisplayName("should allow expiry within the clock skew")
        void shouldAllowSkew() {
            validator.validateToken(
                    token(TestTokens.claims(TestTokens.ISSUER, TestTokens.AUDIENCE, NOW - 3600, NOW - 10)),
                    TestTokens.ISSUER,
                    TestTokens.AUDIENCE,
                    List.of());
        }

        @Test
        @DisplayName("should report NOT_YET_VALID before nbf")
        void shouldReportNotYetValid() {
            final var shifted = TestTokens.claims(TestTokens.ISSUER, TestTokens.AUDIENCE, NOW, NOW + 3600);
            shifted.setNotBefore(NumericDate.fromSeconds(NOW + 600));

            final var error = failure(token(shifted));

            assertEquals(Kind.NOT_YET_VALID, error.kind());
        }

        @Test
        @DisplayName("should report WRONG_ISSUER for another issuer")
        void shouldReportWrongIssuer() {
            final var error = failure(token(
                    TestTokens.claims("https://evil.example.com", TestTokens.AUDIENCE, NOW, NOW + 60)));

            assertEquals(Kind.WRONG_ISSUER, error.kind());
        }

        @Test
        @DisplayName("should report WRONG_AUDIENCE for another audience")
        void shouldReportWrongAudience() {
            final var error = failure(token(
                    TestTokens.claims(TestTokens.ISSUER, "https://other-api", NOW, NOW + 60)));

            assertEquals(Kind.WRONG_AUDIENCE, error.kind());
        }
    }

    @Nested
    @DisplayName("scope checks")
    class ScopeTests {

        @Test
        @DisplayName("should accept a token holding any of the required scopes")
        void shouldAcceptAnyScope() {
            final var claims = validClaims();
            claims.setClaim("scope", "read write");

            final var result = validator.validateToken(
                    token(claims), TestTokens.ISSUER, TestTokens.AUDIENCE, List.of("admin", "write"));

            assertEquals("read write", result.claim("scope").orElseThrow());
        }

        @Test
        @DisplayName("should accept scp arrays")
        void shouldAcceptScpArray() {
            final var claims = validClaims();
            claims.setStringListClaim("scp", "read", "write");

            validator.validateToken(token(claims), TestTokens.ISSUER, TestTokens.AUDIENCE, List.of("read"));
        }

        @Test
        @DisplayName("should report MISSING_REQUIRED_SCOPE when none match")
        void shouldReportMissingScope() {
            final var claims = validClaims();
            claims.setClaim("scope", "read");

            final var error = assertThrows(TokenValidationException.class, () -> validator.validateToken(
                    token(claims), TestTokens.ISSUER, TestTokens.AUDIENCE, List.of("admin")));

            assertEquals(Kind.MISSING_REQUIRED_SCOPE, error.kind());
        }
    }

    @Nested
    @DisplayName("arguments")
    class ArgumentTests {

        @Test
        @DisplayName("should report MALFORMED_ARGUMENT for blank inputs without fetching keys")
        void shouldRejectBlankArguments() {
            final var token = token(validClaims());

            assertEquals(Kind.MALFORMED_ARGUMENT, failure("").kind());
            assertEquals(Kind.MALFORMED_ARGUMENT, assertThrows(TokenValidationException.class,
                    () -> validator.validateToken(token, "", TestTokens.AUDIENCE, List.of())).kind());
            assertEquals(Kind.MALFORMED_ARGUMENT, assertThrows(TokenValidationException.class,
                    () -> validator.validateToken(token, TestTokens.ISSUER, null, List.of())).kind());
            verify(jwksCache, never()).getKey(any(), any());
        }

        @Test
        @DisplayName("should report MALFORMED_ARGUMENT for a token that is not a JWT")
        void shouldRejectGarbage() {
            assertEquals(Kind.MALFORMED_ARGUMENT, failure("abc.def").kind());
        }

        @Test
        @DisplayName("should report MALFORMED_ARGUMENT for a token without an expiry")
        void shouldRejectMissingExpiry() {
            final var claims = validClaims();
            claims.unsetClaim("exp");

            assertEquals(Kind.MALFORMED_ARGUMENT, failure(token(claims)).kind());
        }

        @Test
        @DisplayName("validateIdToken() should use the client ID as audience")
        void idTokenShouldUseClientId() {
            final var claims = TestTokens.claims(TestTokens.ISSUER, "client-1", NOW, NOW + 60);

            validator.validateIdToken(token(claims), TestTokens.ISSUER, "client-1");
        }
    }
}
