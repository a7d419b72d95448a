package authkit.core.service.oidc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import authkit.core.config.AuthKitConfig;
import authkit.core.exception.ProtocolException;
import authkit.core.exception.TokenValidationException;
import authkit.core.exception.TransportException;
import authkit.core.port.out.TransportRequest;
import authkit.core.port.out.TransportResponse;
import authkit.core.service.auth.ClientAuthEnrichers;
import authkit.testsupport.StubHttpTransport;
import authkit.testsupport.TestConfigs;
import authkit.testsupport.TestContexts;

@DisplayName("OidcApiClient")
class OidcApiClientTest {

    private static final String TOKEN_URL = TestConfigs.TOKEN_URL;
    private static final ClientAuthEnricher NO_CLIENT_AUTH = ClientAuthEnrichers.none("client-1");

    private StubHttpTransport transport;
    private AuthKitConfig.HttpConfig http;
    private TokenApiClient tokenClient;

    @BeforeEach
    void setUp() {
        transport = new StubHttpTransport();
        http = TestContexts.config().http();
        tokenClient = new TokenApiClient(transport, TOKEN_URL, http);
    }

    private Map<String, Object> refresh() {
        return tokenClient.getTokenFromRefresh("client-1", "rt", List.of(), Map.of(), NO_CLIENT_AUTH);
    }

    @Nested
    @DisplayName("response classification")
    class ClassificationTests {

        @Test
        @DisplayName("should return the JSON payload of a 2xx response")
        void shouldReturnJson() {
            transport.json(TOKEN_URL, "{\"access_token\":\"at\"}");

            assertEquals("at", refresh().get("access_token"));
        }

        @Test
        @DisplayName("should raise ProtocolException for an error payload, even with status 200")
        void shouldRaiseProtocolErrorForErrorPayload() {
            transport.json(TOKEN_URL, 200, "{\"error\":\"invalid_grant\",\"error_description\":\"bad token\"}");

            final var error = assertThrows(ProtocolException.class, () -> refresh());

            assertEquals("invalid_grant", error.errorCode().orElseThrow());
            assertEquals("bad token", error.errorDescription().orElseThrow());
            assertTrue(error.hasErrorCode("invalid_grant"));
        }

        @Test
        @DisplayName("should prefer the error payload over the HTTP status")
        void shouldPreferPayloadOverStatus() {
            transport.json(TOKEN_URL, 400, "{\"error\":\"authorization_pending\"}");

            final var error = assertThrows(ProtocolException.class, () -> refresh());

            assertEquals(400, error.statusCode());
            assertEquals("authorization_pending", error.errorCode().orElseThrow());
        }

        @Test
        @DisplayName("should read errorCode style payloads")
        void shouldReadErrorCodePayloads() {
            transport.json(TOKEN_URL, 403, "{\"errorCode\":\"E0000011\",\"errorSummary\":\"Invalid token\"}");

            final var error = assertThrows(ProtocolException.class, () -> refresh());

            assertEquals("E0000011", error.errorCode().orElseThrow());
        }

        @Test
        @DisplayName("should raise TransportException for a non-2xx status without an error payload")
        void shouldRaiseTransportErrorForStatus() {
            transport.respond(TOKEN_URL, new TransportResponse(502, Map.of("Content-Type", "text/html"), "<html>"));

            final var error = assertThrows(TransportException.class, () -> refresh());

            assertEquals(502, error.statusCode());
        }

        @Test
        @DisplayName("should raise ProtocolException for a non-JSON success response")
        void shouldRejectNonJsonSuccess() {
            transport.respond(TOKEN_URL, new TransportResponse(200, Map.of("Content-Type", "text/plain"), "ok"));

            assertThrows(ProtocolException.class, () -> refresh());
        }

        @Test
        @DisplayName("should raise ProtocolException for an empty success response")
        void shouldRejectEmptySuccess() {
            transport.json(TOKEN_URL, 200, "");

            assertThrows(ProtocolException.class, () -> refresh());
        }
    }

    @Nested
    @DisplayName("request encoding")
    class RequestTests {

        @Test
        @DisplayName("should post a form with the application header")
        void shouldPostForm() {
            transport.json(TOKEN_URL, "{\"access_token\":\"at\"}");

            tokenClient.getTokenFromRefresh(
                    "client-1",
                    "rt",
                    List.of("openid", "profile"),
                    Map.of("project_id", "p 1"),
                    NO_CLIENT_AUTH);

            final var request = transport.requests().get(0);
            assertEquals(TransportRequest.Method.POST, request.method());
            assertEquals(OidcApiClient.FORM_URLENCODED, request.headers().get("Content-Type"));
            assertEquals(http.applicationName(), request.headers().get(http.applicationHeader()));
            final var form = StubHttpTransport.form(request);
            assertEquals("refresh_token", form.get("grant_type"));
            assertEquals("openid profile", form.get("scope"));
            assertEquals("p 1", form.get("project_id"));
        }

        @Test
        @DisplayName("should omit empty scopes and audiences")
        void shouldOmitEmptyLists() {
            transport.json(TOKEN_URL, "{\"access_token\":\"at\"}");

            tokenClient.getTokenFromClientCredentials(
                    "client-1", List.of(), List.of(), Map.of(), NO_CLIENT_AUTH);

            final var form = StubHttpTransport.form(transport.requests().get(0));
            assertFalse(form.containsKey("scope"));
            assertFalse(form.containsKey("audience"));
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "application/json|application/json",
        "Application/JSON; charset=utf-8|application/json",
        "text/html ;q=1|text/html"
    })
    @DisplayName("parseContentType() should strip parameters and lowercase")
    void shouldParseContentType(String header, String expected) {
        assertEquals(expected, OidcApiClient.parseContentType(header));
    }

    @Test
    @DisplayName("parseContentType() should return null for a missing header")
    void shouldParseMissingContentType() {
        assertNull(OidcApiClient.parseContentType(null));
        assertNull(OidcApiClient.parseContentType(" "));
    }

    @Nested
    @DisplayName("DiscoveryApiClient")
    class DiscoveryTests {

        @Test
        @DisplayName("should fetch the well-known document once")
        void shouldCacheDiscovery() {
            transport.json(TestConfigs.DISCOVERY_URL, "{\"issuer\":\"https://auth.example.com\"}");
            final var discovery = new DiscoveryApiClient(transport, TestConfigs.AUTH_SERVER + "/", http);

            discovery.discovery();
            final var document = discovery.discovery();

            assertEquals("https://auth.example.com", document.get("issuer"));
            assertEquals(1, transport.requests().size());
            assertEquals(TestConfigs.DISCOVERY_URL, discovery.endpointUri());
        }
    }

    @Nested
    @DisplayName("IntrospectionApiClient")
    class IntrospectionTests {

        @Test
        @DisplayName("should return the response of an active token")
        void shouldReturnActive() {
            transport.json(TestConfigs.INTROSPECT_URL, "{\"active\":true,\"sub\":\"user-123\"}");
            final var client = new IntrospectionApiClient(transport, TestConfigs.INTROSPECT_URL, http);

            final var response = client.validateAccessToken("at", NO_CLIENT_AUTH);

            assertEquals("user-123", response.get("sub"));
            assertEquals("access_token", StubHttpTransport.form(transport.requests().get(0)).get("token_type_hint"));
        }

        @Test
        @DisplayName("should report INACTIVE_TOKEN for an inactive token")
        void shouldRejectInactive() {
            transport.json(TestConfigs.INTROSPECT_URL, "{\"active\":false}");
            final var client = new IntrospectionApiClient(transport, TestConfigs.INTROSPECT_URL, http);

            final var error = assertThrows(
                    TokenValidationException.class,
                    () -> client.validateRefreshToken("rt", NO_CLIENT_AUTH));

            assertEquals(TokenValidationException.Kind.INACTIVE_TOKEN, error.kind());
        }
    }

    @Test
    @DisplayName("AuthorizationApiClient should build a PKCE authorization URL")
    void shouldBuildAuthorizationUrl() {
        final var client = new AuthorizationApiClient(TestConfigs.AUTHORIZE_URL);

        final var url = client.authorizationUrl(new AuthorizationApiClient.AuthorizationRequest(
                "client-1", "http://localhost:8080", "st", "no", "ch", List.of("openid"), List.of(), Map.of()));

        assertTrue(url.startsWith(TestConfigs.AUTHORIZE_URL + "?response_type=code&client_id=client-1"));
        assertTrue(url.contains("redirect_uri=http%3A%2F%2Flocalhost%3A8080"));
        assertTrue(url.contains("code_challenge_method=S256"));
    }
}
