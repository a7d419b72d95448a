package authkit.core.service.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import authkit.adapter.out.storage.JsonFileStorage;
import authkit.core.AuthContext;
import authkit.core.exception.AuthorizationCodeException;
import authkit.core.exception.AuthorizationCodeException.Reason;
import authkit.core.exception.ConfigException;
import authkit.core.model.auth.AuthorizationCallback;
import authkit.core.model.auth.LoginRequest;
import authkit.core.model.config.OidcClientConfig;
import authkit.core.port.out.AuthorizationCallbackReceiver;
import authkit.core.port.out.AuthorizationCallbackReceiver.PendingCallback;
import authkit.core.service.auth.JwksCacheService;
import authkit.core.service.auth.PkceService;
import authkit.spi.BrowserLauncher;
import authkit.spi.LoginPrompter;
import authkit.testsupport.MutableClock;
import authkit.testsupport.StubHttpTransport;
import authkit.testsupport.TestConfigs;
import authkit.testsupport.TestContexts;
import authkit.testsupport.TestTokens;

@DisplayName("AuthCodeAuthClient")
@ExtendWith(MockitoExtension.class)
class AuthCodeAuthClientTest {

    private static final String STATE = "fixed-state";
    private static final String NONCE = "fixed-nonce";
    private static final String VERIFIER = "fixed-verifier-0123456789-0123456789-0123456789";
    private static final long NOW = 1_700_000_000L;

    private static RsaJsonWebKey key;

    @Mock
    private BrowserLauncher browserLauncher;

    @Mock
    private LoginPrompter loginPrompter;

    @Mock
    private AuthorizationCallbackReceiver callbackReceiver;

    @Mock
    private PendingCallback pendingCallback;

    private StubHttpTransport transport;

    @BeforeAll
    static void setUpKey() {
        key = TestTokens.newKey("id-key");
    }

    @BeforeEach
    void setUp() {
        transport = new StubHttpTransport();
    }

    private AuthCodeAuthClient client(OidcClientConfig config) {
        final var cfg = TestContexts.config();
        final var pkce = new PkceService() {
            @Override
            public String generateCodeVerifier() {
                return VERIFIER;
            }

            @Override
            public String generateState() {
                return STATE;
            }

            @Override
            public String generateNonce() {
                return NONCE;
            }
        };
        final var context = new AuthContext(
                cfg,
                new MutableClock(NOW),
                duration -> {},
                transport,
                new JwksCacheService(transport, cfg),
                new JsonFileStorage(),
                browserLauncher,
                loginPrompter,
                callbackReceiver,
                pkce);
        return new AuthCodeAuthClient(config, context);
    }

    private AuthCodeAuthClient client() {
        return client(TestConfigs.oidc("oidc_auth_code"));
    }

    private static LoginRequest browserLogin() {
        return LoginRequest.builder().allowOpenBrowser(true).allowTtyPrompt(true).build();
    }

    private void callbackDelivers(AuthorizationCallback callback) {
        when(callbackReceiver.listen(eq(URI.create(OidcClientConfig.DEFAULT_LOCAL_REDIRECT_URI)), isNull()))
                .thenReturn(pendingCallback);
        when(pendingCallback.await(any(Duration.class))).thenReturn(callback);
    }

    private static String idToken(String nonce) {
        final var claims = TestTokens.claims(TestTokens.ISSUER, "client-1", NOW, NOW + 3600);
        if (nonce != null) {
            claims.setClaim("nonce", nonce);
        }
        return TestTokens.sign(key, claims);
    }

    @Nested
    @DisplayName("with a browser")
    class BrowserTests {

        @Test
        @DisplayName("should exchange the code from the local callback")
        void shouldExchangeCallbackCode() {
            callbackDelivers(AuthorizationCallback.success("the-code", STATE));
            when(browserLauncher.open(any())).thenReturn(true);
            transport.json(TestConfigs.TOKEN_URL, "{\"access_token\":\"at\",\"id_token\":\"" + idToken(NONCE) + "\"}");

            final var credential = client().login(browserLogin());

            assertEquals("at", credential.accessToken().orElseThrow());
            final var form = StubHttpTransport.form(transport.requests().get(0));
            assertEquals("authorization_code", form.get("grant_type"));
            assertEquals("the-code", form.get("code"));
            assertEquals(VERIFIER, form.get("code_verifier"));
            assertEquals(OidcClientConfig.DEFAULT_LOCAL_REDIRECT_URI, form.get("redirect_uri"));
            verify(pendingCallback).close();
        }

        @Test
        @DisplayName("should open an authorization URL carrying state, nonce and the S256 challenge")
        void shouldOpenAuthorizationUrl() {
            callbackDelivers(AuthorizationCallback.success("the-code", STATE));
            when(browserLauncher.open(any())).thenReturn(true);
            transport.json(TestConfigs.TOKEN_URL, TestConfigs.tokenResponse("at", null));

            client().login(browserLogin());

            final var captor = ArgumentCaptor.forClass(URI.class);
            verify(browserLauncher).open(captor.capture());
            final var url = captor.getValue().toString();
            assertTrue(url.startsWith(TestConfigs.AUTHORIZE_URL + "?"));
            assertTrue(url.contains("state=" + STATE));
            assertTrue(url.contains("nonce=" + NONCE));
            assertTrue(url.contains("code_challenge=" + new PkceService().generateChallenge(VERIFIER)));
            assertTrue(url.contains("audience=https%3A%2F%2Fapi.example.com"));
        }

        @Test
        @DisplayName("should show the URL when no browser can be opened")
        void shouldPresentUrlWithoutBrowser() {
            callbackDelivers(AuthorizationCallback.success("the-code", STATE));
            when(browserLauncher.open(any())).thenReturn(false);
            transport.json(TestConfigs.TOKEN_URL, TestConfigs.tokenResponse("at", null));

            client().login(browserLogin());

            verify(loginPrompter).presentAuthorizationUrl(any());
        }

        @Test
        @DisplayName("should fail with STATE_MISMATCH and not exchange the code")
        void shouldRejectStateMismatch() {
            callbackDelivers(AuthorizationCallback.success("the-code", "other-state"));
            when(browserLauncher.open(any())).thenReturn(true);

            final var error = assertThrows(AuthorizationCodeException.class, () -> client().login(browserLogin()));

            assertEquals(Reason.STATE_MISMATCH, error.reason());
            assertTrue(transport.requests().isEmpty());
        }

        @Test
        @DisplayName("should report USER_CANCELLED when the user denies access")
        void shouldReportDenied() {
            callbackDelivers(new AuthorizationCallback(null, STATE, "access_denied", "User said no"));
            when(browserLauncher.open(any())).thenReturn(true);

            final var error = assertThrows(AuthorizationCodeException.class, () -> client().login(browserLogin()));

            assertEquals(Reason.USER_CANCELLED, error.reason());
        }

        @Test
        @DisplayName("should report SERVER_ERROR for other callback errors")
        void shouldReportServerError() {
            callbackDelivers(new AuthorizationCallback(null, STATE, "server_error", null));
            when(browserLauncher.open(any())).thenReturn(true);

            final var error = assertThrows(AuthorizationCodeException.class, () -> client().login(browserLogin()));

            assertEquals(Reason.SERVER_ERROR, error.reason());
        }

        @Test
        @DisplayName("should fail with NONCE_MISMATCH for an ID token bound to another request")
        void shouldRejectNonceMismatch() {
            callbackDelivers(AuthorizationCallback.success("the-code", STATE));
            when(browserLauncher.open(any())).thenReturn(true);
            transport.json(TestConfigs.TOKEN_URL, "{\"id_token\":\"" + idToken("someone-else") + "\"}");

            final var error = assertThrows(AuthorizationCodeException.class, () -> client().login(browserLogin()));

            assertEquals(Reason.NONCE_MISMATCH, error.reason());
        }

        @Test
        @DisplayName("should fail with NONCE_MISMATCH for an ID token without a nonce")
        void shouldRejectMissingNonce() {
            callbackDelivers(AuthorizationCallback.success("the-code", STATE));
            when(browserLauncher.open(any())).thenReturn(true);
            transport.json(TestConfigs.TOKEN_URL, "{\"id_token\":\"" + idToken(null) + "\"}");

            final var error = assertThrows(AuthorizationCodeException.class, () -> client().login(browserLogin()));

            assertEquals(Reason.NONCE_MISMATCH, error.reason());
        }
    }

    @Nested
    @DisplayName("without a browser")
    class ManualTests {

        private final LoginRequest promptOnly = LoginRequest.builder().allowTtyPrompt(true).build();

        @Test
        @DisplayName("should exchange a pasted code against the remote redirect URI")
        void shouldExchangePastedCode() {
            final var map = TestConfigs.oidcMap("oidc_auth_code");
            map.put("remote_redirect_uri", "https://app.example.com/callback");
            when(loginPrompter.promptForAuthorizationCode(any())).thenReturn(Optional.of("  pasted  "));
            transport.json(TestConfigs.TOKEN_URL, TestConfigs.tokenResponse("at", "rt"));

            client(TestConfigs.oidc(map)).login(promptOnly);

            final var form = StubHttpTransport.form(transport.requests().get(0));
            assertEquals("pasted", form.get("code"));
            assertEquals("https://app.example.com/callback", form.get("redirect_uri"));
            verifyNoInteractions(callbackReceiver);
        }

        @Test
        @DisplayName("should require a remote redirect URI")
        void shouldRequireRemoteRedirect() {
            assertThrows(ConfigException.class, () -> client().login(promptOnly));
            verify(loginPrompter, never()).promptForAuthorizationCode(any());
        }

        @Test
        @DisplayName("should report USER_CANCELLED when nothing is entered")
        void shouldReportEmptyInput() {
            final var map = TestConfigs.oidcMap("oidc_auth_code");
            map.put("remote_redirect_uri", "https://app.example.com/callback");
            when(loginPrompter.promptForAuthorizationCode(any())).thenReturn(Optional.empty());

            final var error = assertThrows(
                    AuthorizationCodeException.class, () -> client(TestConfigs.oidc(map)).login(promptOnly));

            assertEquals(Reason.USER_CANCELLED, error.reason());
        }
    }

    @Test
    @DisplayName("should refuse to log in when no interaction is allowed")
    void shouldRefuseWithoutInteraction() {
        final var error =
                assertThrows(AuthorizationCodeException.class, () -> client().login(LoginRequest.defaults()));

        assertEquals(Reason.NO_INTERACTION_ALLOWED, error.reason());
        verifyNoInteractions(callbackReceiver, browserLauncher, loginPrompter);
    }
}
