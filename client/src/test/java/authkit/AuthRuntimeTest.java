package authkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Clock;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import authkit.adapter.in.callback.VertxAuthorizationCallbackServer;
import authkit.adapter.out.http.VertxHttpTransport;
import authkit.adapter.out.storage.JsonFileStorage;
import authkit.core.config.AuthKitConfigLoader;
import authkit.core.service.auth.JwksCacheService;
import authkit.spi.HeadlessLoginPrompter;
import authkit.testsupport.MutableClock;
import authkit.testsupport.StubHttpTransport;

@DisplayName("AuthRuntime")
class AuthRuntimeTest {

    @Test
    @DisplayName("should fill in default adapters")
    void shouldUseDefaults() {
        try (var runtime = AuthRuntime.builder().build()) {
            final var context = runtime.context();

            assertInstanceOf(VertxHttpTransport.class, context.transport());
            assertInstanceOf(VertxAuthorizationCallbackServer.class, context.callbackReceiver());
            assertInstanceOf(JwksCacheService.class, context.jwksCache());
            assertInstanceOf(JsonFileStorage.class, context.documentStore());
            assertInstanceOf(HeadlessLoginPrompter.class, context.loginPrompter());
            assertEquals(Clock.systemUTC().getZone(), context.clock().getZone());
        }
    }

    @Test
    @DisplayName("should use supplied collaborators and config")
    void shouldUseSuppliedCollaborators() {
        final var transport = new StubHttpTransport();
        final var clock = new MutableClock(42);
        final var config = AuthKitConfigLoader.load(Map.of("authkit.http.max-retries", "1"));

        try (var runtime = AuthRuntime.builder().config(config).clock(clock).transport(transport).build()) {
            final var context = runtime.context();

            assertSame(transport, context.transport());
            assertSame(clock, context.clock());
            assertEquals(1, context.config().http().maxRetries());
            assertEquals(42, context.nowEpochSeconds());
        }
    }
}
