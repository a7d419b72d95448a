package authkit.core;

import java.time.Clock;
import java.util.Objects;

import authkit.core.config.AuthKitConfig;
import authkit.core.port.out.AuthorizationCallbackReceiver;
import authkit.core.port.out.HttpTransport;
import authkit.core.port.out.JsonDocumentStore;
import authkit.core.port.out.JwksCache;
import authkit.core.service.auth.PkceService;
import authkit.core.util.Sleeper;
import authkit.spi.BrowserLauncher;
import authkit.spi.LoginPrompter;

/**
 * Collaborators shared by every auth client created for one application.
 *
 * <p>Built once at startup and passed down explicitly. There is no process-wide registry.
 *
 * @param config           library tunables
 * @param clock            time source for token timing decisions
 * @param sleeper          waits between device code polls
 * @param transport        HTTP transport to authorization servers
 * @param jwksCache        shared JWKS cache
 * @param documentStore    credential and config file storage
 * @param browserLauncher  opens authorization URLs
 * @param loginPrompter    interacts with the user during login
 * @param callbackReceiver receives authorization code redirects
 * @param pkceService      generates PKCE, state and nonce values
 */
public record AuthContext(
        AuthKitConfig config,
        Clock clock,
        Sleeper sleeper,
        HttpTransport transport,
        JwksCache jwksCache,
        JsonDocumentStore documentStore,
        BrowserLauncher browserLauncher,
        LoginPrompter loginPrompter,
        AuthorizationCallbackReceiver callbackReceiver,
        PkceService pkceService) {

    public AuthContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(jwksCache, "jwksCache");
        Objects.requireNonNull(documentStore, "documentStore");
        Objects.requireNonNull(browserLauncher, "browserLauncher");
        Objects.requireNonNull(loginPrompter, "loginPrompter");
        Objects.requireNonNull(callbackReceiver, "callbackReceiver");
        Objects.requireNonNull(pkceService, "pkceService");
    }

    public long nowEpochSeconds() {
        return clock.instant().getEpochSecond();
    }
}
